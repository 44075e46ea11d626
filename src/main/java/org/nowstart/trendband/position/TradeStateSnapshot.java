package org.nowstart.trendband.position;

import java.time.Instant;
import org.nowstart.trendband.data.type.PositionPhase;

public record TradeStateSnapshot(
        PositionPhase phase,
        OpenPosition position,
        boolean locked,
        Instant lockedAfter,
        Instant lastExitAt,
        PendingExit pendingExit
) {

    public static TradeStateSnapshot initial() {
        return new TradeStateSnapshot(PositionPhase.FLAT, null, false, null, null, null);
    }
}
