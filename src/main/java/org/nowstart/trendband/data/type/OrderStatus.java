package org.nowstart.trendband.data.type;

public enum OrderStatus {
    FILLED,
    ACCEPTED,
    FAILED
}
