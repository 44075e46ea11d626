package org.nowstart.trendband.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OkxPositionResponse(
        String instId,
        String posSide,
        String pos,
        String avgPx,
        String upl
) {
}
