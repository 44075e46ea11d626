package org.nowstart.trendband.data.type;

public enum PositionPhase {
    FLAT,
    OPEN,
    LOCKED
}
