package org.nowstart.trendband.data.type;

public enum ExitReason {
    STOP_LOSS,
    TRAILING_PROFIT,
    TAKE_PROFIT,
    TREND_FLIP,
    BASKET_TARGET,
    BASKET_STOP;

    /**
     * Exits settled at the stop level rather than at the venue's market fill.
     */
    public boolean isStopPriced() {
        return this == STOP_LOSS || this == TRAILING_PROFIT;
    }

    public boolean isStopLoss() {
        return this == STOP_LOSS || this == BASKET_STOP;
    }
}
