package org.nowstart.trendband.data.dto;

import java.util.List;
import org.nowstart.trendband.strategy.core.OhlcvCandle;

public record MarketSnapshot(
        List<OhlcvCandle> closedCandles,
        OhlcvCandle forming,
        double lastPrice
) {
}
