package org.nowstart.trendband.indicator;

import java.time.Instant;

public record IndicatorPoint(
        Instant timestamp,
        double high,
        double low,
        double close,
        double emaFast,
        double emaSlow,
        double emaTrend,
        double atr,
        double envelopeUpper,
        double envelopeLower,
        double envelopeMid
) {

    public boolean insideEnvelope(double price) {
        return price >= envelopeLower && price <= envelopeUpper;
    }
}
