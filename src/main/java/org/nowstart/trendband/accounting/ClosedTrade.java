package org.nowstart.trendband.accounting;

import java.math.BigDecimal;
import java.time.Instant;
import org.nowstart.trendband.data.type.ExitReason;
import org.nowstart.trendband.data.type.PositionSide;

public record ClosedTrade(
        Instant closedAt,
        PositionSide side,
        double entryPrice,
        double exitPrice,
        BigDecimal quantity,
        BigDecimal pnl,
        ExitReason reason
) {

    public boolean isWin() {
        return pnl.signum() > 0;
    }
}
