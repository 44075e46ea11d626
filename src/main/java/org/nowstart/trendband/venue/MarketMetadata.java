package org.nowstart.trendband.venue;

import java.math.BigDecimal;

public record MarketMetadata(
        BigDecimal tickSize,
        BigDecimal quantityStep,
        BigDecimal minQuantity,
        BigDecimal contractValue
) {

    public MarketMetadata {
        if (quantityStep == null || quantityStep.signum() <= 0) {
            throw new IllegalArgumentException("quantityStep must be positive");
        }
        if (minQuantity == null || minQuantity.signum() < 0) {
            throw new IllegalArgumentException("minQuantity must not be negative");
        }
        if (contractValue == null || contractValue.signum() <= 0) {
            throw new IllegalArgumentException("contractValue must be positive");
        }
    }
}
