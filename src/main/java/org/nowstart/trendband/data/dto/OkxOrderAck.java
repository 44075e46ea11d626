package org.nowstart.trendband.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OkxOrderAck(
        String ordId,
        String clOrdId,
        String sCode,
        String sMsg
) {
}
