package org.nowstart.trendband.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OkxResponse<T>(
        String code,
        String msg,
        List<T> data
) {

    public boolean isOk() {
        return "0".equals(code);
    }

    public List<T> dataOrEmpty() {
        return data == null ? List.of() : data;
    }
}
