package org.nowstart.trendband.indicator;

public record EnvelopeBand(
        double upper,
        double lower,
        double mid
) {
}
