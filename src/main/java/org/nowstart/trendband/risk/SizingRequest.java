package org.nowstart.trendband.risk;

import java.math.BigDecimal;
import org.nowstart.trendband.venue.MarketMetadata;

public record SizingRequest(
        BigDecimal freeEquity,
        BigDecimal totalEquity,
        double entryPrice,
        double stopPrice,
        int legCount,
        MarketMetadata metadata
) {
}
