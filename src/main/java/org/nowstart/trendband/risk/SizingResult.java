package org.nowstart.trendband.risk;

import java.math.BigDecimal;

public record SizingResult(
        BigDecimal quantity,
        BigDecimal notional,
        BigDecimal margin,
        int maxLegs,
        String reason
) {

    public static SizingResult rejected(String reason, int maxLegs) {
        return new SizingResult(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, maxLegs, reason);
    }

    public boolean tradable() {
        return quantity != null && quantity.signum() > 0;
    }
}
