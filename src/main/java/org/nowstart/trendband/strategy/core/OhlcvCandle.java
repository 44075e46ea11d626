package org.nowstart.trendband.strategy.core;

import java.time.Instant;

/**
 * One exchange candle. {@code closed == false} marks the still-forming bar, which must never reach the
 * indicator engine.
 */
public record OhlcvCandle(
        Instant timestamp,
        double open,
        double high,
        double low,
        double close,
        double volume,
        boolean closed
) {

    public static OhlcvCandle closed(Instant timestamp, double open, double high, double low, double close) {
        return new OhlcvCandle(timestamp, open, high, low, close, 0.0, true);
    }

    public static OhlcvCandle point(Instant timestamp, double price) {
        return new OhlcvCandle(timestamp, price, price, price, price, 0.0, false);
    }
}
