package org.nowstart.trendband.venue;

import java.math.BigDecimal;
import org.nowstart.trendband.data.type.OrderSide;
import org.nowstart.trendband.data.type.PositionSide;

public record OrderRequest(
        String symbol,
        OrderSide side,
        PositionSide positionSide,
        BigDecimal quantity,
        boolean reduceOnly,
        double referencePrice
) {

    public static OrderRequest open(String symbol, PositionSide side, BigDecimal quantity, double referencePrice) {
        return new OrderRequest(symbol, side.entryOrderSide(), side, quantity, false, referencePrice);
    }

    public static OrderRequest close(String symbol, PositionSide side, BigDecimal quantity, double referencePrice) {
        return new OrderRequest(symbol, side.exitOrderSide(), side, quantity, true, referencePrice);
    }

    public OrderRequest withQuantity(BigDecimal newQuantity) {
        return new OrderRequest(symbol, side, positionSide, newQuantity, reduceOnly, referencePrice);
    }
}
