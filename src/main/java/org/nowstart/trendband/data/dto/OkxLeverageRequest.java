package org.nowstart.trendband.data.dto;

public record OkxLeverageRequest(
        String instId,
        String lever,
        String mgnMode
) {
}
