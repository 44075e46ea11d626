package org.nowstart.trendband.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OkxInstrumentResponse(
        String instId,
        String tickSz,
        String lotSz,
        String minSz,
        String ctVal
) {
}
