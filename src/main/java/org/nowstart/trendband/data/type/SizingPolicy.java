package org.nowstart.trendband.data.type;

public enum SizingPolicy {
    RISK_FRACTION,
    LADDER,
    MARGIN_FRACTION
}
