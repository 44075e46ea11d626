package org.nowstart.trendband.data.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OkxOrderRequest(
        String instId,
        String tdMode,
        String side,
        String posSide,
        String ordType,
        String sz,
        Boolean reduceOnly
) {
}
