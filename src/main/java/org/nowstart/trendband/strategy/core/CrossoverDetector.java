package org.nowstart.trendband.strategy.core;

import org.nowstart.trendband.data.type.SignalDirection;

public final class CrossoverDetector {

    private CrossoverDetector() {
    }

    /**
     * A cross needs the previous tick on or behind the opposite side of slow and the current tick beyond slow by
     * more than {@code threshold}. Staying close to slow never re-triggers.
     */
    public static SignalDirection detect(
            double previousFast,
            double previousSlow,
            double currentFast,
            double currentSlow,
            double threshold
    ) {
        if (!Double.isFinite(previousFast) || !Double.isFinite(previousSlow)
                || !Double.isFinite(currentFast) || !Double.isFinite(currentSlow)) {
            return SignalDirection.NONE;
        }

        boolean up = previousFast <= previousSlow && currentFast > currentSlow + threshold;
        boolean down = previousFast >= previousSlow && currentFast < currentSlow - threshold;
        if (up == down) {
            return SignalDirection.NONE;
        }
        return up ? SignalDirection.LONG : SignalDirection.SHORT;
    }
}
