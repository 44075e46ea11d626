package org.nowstart.trendband.venue;

import java.math.BigDecimal;

public record EquitySnapshot(
        BigDecimal free,
        BigDecimal total
) {
}
