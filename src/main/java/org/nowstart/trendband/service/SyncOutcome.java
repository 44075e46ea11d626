package org.nowstart.trendband.service;

public enum SyncOutcome {
    IN_SYNC,
    REFRESHED,
    ADOPTED,
    LOCAL_CORRECTED,
    EXIT_CONFIRMED
}
