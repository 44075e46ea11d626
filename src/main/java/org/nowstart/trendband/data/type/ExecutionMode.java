package org.nowstart.trendband.data.type;

public enum ExecutionMode {
    LIVE,
    PAPER
}
