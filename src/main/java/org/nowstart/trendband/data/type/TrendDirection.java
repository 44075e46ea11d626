package org.nowstart.trendband.data.type;

public enum TrendDirection {
    UP,
    DOWN,
    NONE;

    public boolean opposes(PositionSide side) {
        return (side == PositionSide.LONG && this == DOWN) || (side == PositionSide.SHORT && this == UP);
    }
}
