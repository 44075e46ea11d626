package org.nowstart.trendband.position;

import java.math.BigDecimal;
import org.nowstart.trendband.data.type.TrendDirection;
import org.nowstart.trendband.indicator.IndicatorPoint;
import org.nowstart.trendband.strategy.core.Signal;
import org.nowstart.trendband.strategy.core.OhlcvCandle;

public record PositionContext(
        OhlcvCandle bar,
        double currentPrice,
        IndicatorPoint previous,
        IndicatorPoint latest,
        TrendDirection trend,
        Signal signal,
        BigDecimal totalEquity,
        int maxLegs
) {
}
