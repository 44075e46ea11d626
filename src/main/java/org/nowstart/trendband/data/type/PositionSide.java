package org.nowstart.trendband.data.type;

import java.util.Locale;

public enum PositionSide {
    LONG,
    SHORT;

    public int sign() {
        return this == LONG ? 1 : -1;
    }

    public OrderSide entryOrderSide() {
        return this == LONG ? OrderSide.BUY : OrderSide.SELL;
    }

    public OrderSide exitOrderSide() {
        return this == LONG ? OrderSide.SELL : OrderSide.BUY;
    }

    public SignalDirection direction() {
        return this == LONG ? SignalDirection.LONG : SignalDirection.SHORT;
    }

    public String venueValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PositionSide fromDirection(SignalDirection direction) {
        return switch (direction) {
            case LONG -> LONG;
            case SHORT -> SHORT;
            case NONE -> throw new IllegalArgumentException("direction NONE has no position side");
        };
    }
}
