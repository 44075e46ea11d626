package org.nowstart.trendband.venue;

import java.util.List;
import org.nowstart.trendband.strategy.core.OhlcvCandle;

public interface PriceFeed {

    /**
     * Candles oldest first. The newest element may be a forming bar flagged with {@code closed == false}.
     */
    List<OhlcvCandle> fetchCandles(String symbol, String timeframe, int count);

    double lastPrice(String symbol);
}
