package org.nowstart.trendband.service;

import org.nowstart.trendband.venue.OrderResult;

public record ExitAttempt(
        boolean confirmed,
        OrderResult order
) {

    public static ExitAttempt confirmed(OrderResult order) {
        return new ExitAttempt(true, order);
    }

    public static ExitAttempt unconfirmed(OrderResult order) {
        return new ExitAttempt(false, order);
    }
}
