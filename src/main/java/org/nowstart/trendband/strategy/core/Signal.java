package org.nowstart.trendband.strategy.core;

import org.nowstart.trendband.data.type.SignalDirection;
import org.nowstart.trendband.data.type.StrategyVariant;

public record Signal(
        SignalDirection direction,
        StrategyVariant variant,
        String reason
) {

    public static Signal none(StrategyVariant variant, String reason) {
        return new Signal(SignalDirection.NONE, variant, reason);
    }

    public static Signal of(SignalDirection direction, StrategyVariant variant, String reason) {
        return new Signal(direction, variant, reason);
    }

    public boolean isActionable() {
        return direction.isActionable();
    }
}
