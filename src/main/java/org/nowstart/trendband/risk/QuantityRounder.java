package org.nowstart.trendband.risk;

import java.math.BigDecimal;
import java.math.RoundingMode;
import org.nowstart.trendband.venue.MarketMetadata;

public final class QuantityRounder {

    static final int DIVISION_SCALE = 12;

    private QuantityRounder() {
    }

    public static BigDecimal roundDown(BigDecimal quantity, BigDecimal step) {
        if (quantity == null || quantity.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return quantity.divide(step, 0, RoundingMode.DOWN).multiply(step);
    }

    public static BigDecimal clampToMinimum(BigDecimal quantity, BigDecimal minQuantity) {
        if (quantity == null || quantity.signum() <= 0 || quantity.compareTo(minQuantity) < 0) {
            return BigDecimal.ZERO;
        }
        return quantity;
    }

    public static BigDecimal normalize(BigDecimal quantity, MarketMetadata metadata) {
        return clampToMinimum(roundDown(quantity, metadata.quantityStep()), metadata.minQuantity());
    }

    public static BigDecimal quantityFor(BigDecimal notional, double price, MarketMetadata metadata) {
        if (notional == null || notional.signum() <= 0 || !Double.isFinite(price) || price <= 0.0) {
            return BigDecimal.ZERO;
        }
        BigDecimal raw = notional.divide(BigDecimal.valueOf(price), DIVISION_SCALE, RoundingMode.DOWN);
        return normalize(raw, metadata);
    }
}
