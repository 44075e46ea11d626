package org.nowstart.trendband.risk;

import java.math.BigDecimal;
import org.nowstart.trendband.data.type.SizingPolicy;

public interface PositionSizer {

    SizingPolicy policy();

    SizingResult size(SizingRequest request);

    default int maxLegs(BigDecimal totalEquity) {
        return 1;
    }
}
