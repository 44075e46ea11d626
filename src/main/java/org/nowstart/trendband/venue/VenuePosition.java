package org.nowstart.trendband.venue;

import java.math.BigDecimal;
import org.nowstart.trendband.data.type.PositionSide;

public record VenuePosition(
        PositionSide side,
        BigDecimal quantity,
        double entryPrice,
        BigDecimal unrealizedPnl
) {
}
