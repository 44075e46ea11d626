package org.nowstart.trendband.position;

import java.math.BigDecimal;

public record BasketLeg(
        double price,
        BigDecimal quantity
) {
}
