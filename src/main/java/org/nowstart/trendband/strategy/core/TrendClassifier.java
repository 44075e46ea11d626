package org.nowstart.trendband.strategy.core;

import org.nowstart.trendband.data.type.TrendDirection;

public final class TrendClassifier {

    private TrendClassifier() {
    }

    /**
     * UP only when fast clears slow by more than {@code margin}, DOWN symmetrically, NONE in between.
     */
    public static TrendDirection classify(double emaFast, double emaSlow, double margin) {
        if (!Double.isFinite(emaFast) || !Double.isFinite(emaSlow)) {
            return TrendDirection.NONE;
        }
        if (emaFast > emaSlow + margin) {
            return TrendDirection.UP;
        }
        if (emaFast < emaSlow - margin) {
            return TrendDirection.DOWN;
        }
        return TrendDirection.NONE;
    }
}
