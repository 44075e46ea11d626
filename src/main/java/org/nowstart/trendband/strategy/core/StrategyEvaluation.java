package org.nowstart.trendband.strategy.core;

import org.nowstart.trendband.data.type.TrendDirection;

/**
 * @param signal entry signal for this tick, at most one
 * @param trend  fast/slow trend classification, also used to force trend-flip exits
 * @param regime sideways regime check; {@code null} when the variant does not use it
 */
public record StrategyEvaluation(
        Signal signal,
        TrendDirection trend,
        RegimeCheck regime
) {
}
