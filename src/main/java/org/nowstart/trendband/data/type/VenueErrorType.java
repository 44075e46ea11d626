package org.nowstart.trendband.data.type;

public enum VenueErrorType {
    TRANSIENT,
    INSUFFICIENT_MARGIN,
    BELOW_MINIMUM,
    REJECTED,
    FATAL
}
