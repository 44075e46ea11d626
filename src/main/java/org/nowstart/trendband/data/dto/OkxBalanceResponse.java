package org.nowstart.trendband.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OkxBalanceResponse(
        String totalEq,
        List<Detail> details
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Detail(
            String ccy,
            String availBal,
            String ordFrozen,
            String eq
    ) {
    }
}
