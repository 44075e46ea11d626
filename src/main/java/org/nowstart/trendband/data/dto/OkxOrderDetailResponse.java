package org.nowstart.trendband.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OkxOrderDetailResponse(
        String ordId,
        String state,
        String avgPx,
        String accFillSz
) {
}
