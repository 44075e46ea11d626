package org.nowstart.trendband.data.type;

public enum SignalDirection {
    LONG,
    SHORT,
    NONE;

    public boolean isActionable() {
        return this != NONE;
    }

    public boolean opposes(PositionSide side) {
        return (side == PositionSide.LONG && this == SHORT) || (side == PositionSide.SHORT && this == LONG);
    }
}
