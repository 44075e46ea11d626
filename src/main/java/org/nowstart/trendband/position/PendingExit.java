package org.nowstart.trendband.position;

import java.time.Instant;
import org.nowstart.trendband.data.type.ExitReason;

public record PendingExit(
        ExitReason reason,
        double decisionPrice,
        Instant requestedAt
) {
}
