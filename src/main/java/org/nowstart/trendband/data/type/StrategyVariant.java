package org.nowstart.trendband.data.type;

public enum StrategyVariant {
    CROSSOVER,
    ENVELOPE_TOUCH,
    EXTENSION_REVERSION
}
