package org.nowstart.trendband.position;

import java.time.Instant;
import lombok.Getter;
import lombok.Setter;
import org.nowstart.trendband.data.type.PositionPhase;

@Getter
@Setter
public class TradeState {

    private OpenPosition position;
    private boolean locked;
    // latest closed bar when the lock was set; only later bars can release it
    private Instant lockedAfter;
    // latest closed bar at the last confirmed exit; cooldown counts bars after it
    private Instant lastExitAt;
    private PendingExit pendingExit;
    private boolean unlockedThisCycle;

    public PositionPhase phase() {
        if (position != null) {
            return PositionPhase.OPEN;
        }
        return locked ? PositionPhase.LOCKED : PositionPhase.FLAT;
    }

    public boolean hasPosition() {
        return position != null;
    }

    public void clearPosition() {
        position = null;
        pendingExit = null;
    }

    public TradeStateSnapshot snapshot() {
        return new TradeStateSnapshot(phase(), position, locked, lockedAfter, lastExitAt, pendingExit);
    }
}
