package org.nowstart.trendband.venue;

import java.math.BigDecimal;
import org.nowstart.trendband.data.type.OrderStatus;
import org.nowstart.trendband.data.type.VenueErrorType;

public record OrderResult(
        OrderStatus status,
        String orderId,
        BigDecimal quantity,
        // NaN when the venue only acknowledged the order
        double avgPrice,
        VenueErrorType errorType,
        String message
) {

    public static OrderResult filled(String orderId, BigDecimal quantity, double avgPrice) {
        return new OrderResult(OrderStatus.FILLED, orderId, quantity, avgPrice, null, null);
    }

    public static OrderResult accepted(String orderId, BigDecimal quantity) {
        return new OrderResult(OrderStatus.ACCEPTED, orderId, quantity, Double.NaN, null, null);
    }

    public static OrderResult failed(VenueErrorType errorType, String message) {
        return new OrderResult(OrderStatus.FAILED, null, BigDecimal.ZERO, Double.NaN, errorType, message);
    }

    public boolean isSuccess() {
        return status != OrderStatus.FAILED;
    }

    public boolean hasFillPrice() {
        return Double.isFinite(avgPrice) && avgPrice > 0.0;
    }
}
