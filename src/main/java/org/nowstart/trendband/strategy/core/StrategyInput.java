package org.nowstart.trendband.strategy.core;

import org.nowstart.trendband.indicator.IndicatorFrame;

/**
 * @param frame        indicators over closed bars only
 * @param currentPrice latest traded price, which may belong to the forming bar
 */
public record StrategyInput(
        IndicatorFrame frame,
        double currentPrice
) {

    public StrategyInput {
        if (frame == null || frame.size() < 2) {
            throw new IllegalArgumentException("at least two closed bars are required");
        }
        if (!Double.isFinite(currentPrice) || currentPrice <= 0.0) {
            throw new IllegalArgumentException("currentPrice must be positive");
        }
    }
}
