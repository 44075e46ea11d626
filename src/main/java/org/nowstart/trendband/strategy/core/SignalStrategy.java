package org.nowstart.trendband.strategy.core;

import org.nowstart.trendband.data.type.StrategyVariant;

/**
 * Entry logic of one strategy variant: closed history plus current price in, one signal out.
 */
public interface SignalStrategy {

    StrategyVariant variant();

    StrategyEvaluation evaluate(StrategyInput input);
}
