package org.nowstart.trendband.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.trendband.data.dto.MarketSnapshot;
import org.nowstart.trendband.data.property.StrategyProperties;
import org.nowstart.trendband.data.property.TradingProperties;
import org.nowstart.trendband.indicator.IndicatorEngine;
import org.nowstart.trendband.indicator.IndicatorFrame;
import org.nowstart.trendband.indicator.IndicatorSettings;
import org.nowstart.trendband.strategy.core.OhlcvCandle;
import org.nowstart.trendband.venue.PriceFeed;
import org.nowstart.trendband.venue.VenueCallExecutor;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class TradingSignalMarketDataService {

    private final PriceFeed priceFeed;
    private final VenueCallExecutor venueCallExecutor;
    private final IndicatorEngine indicatorEngine;
    private final TradingProperties tradingProperties;
    private final IndicatorSettings indicatorSettings;

    public TradingSignalMarketDataService(
            PriceFeed priceFeed,
            VenueCallExecutor venueCallExecutor,
            IndicatorEngine indicatorEngine,
            TradingProperties tradingProperties,
            StrategyProperties strategyProperties
    ) {
        this.priceFeed = priceFeed;
        this.venueCallExecutor = venueCallExecutor;
        this.indicatorEngine = indicatorEngine;
        this.tradingProperties = tradingProperties;
        this.indicatorSettings = IndicatorSettings.from(strategyProperties);
    }

    public int requiredCandleCount() {
        return Math.max(tradingProperties.candleCount(), indicatorSettings.requiredBars());
    }

    public MarketSnapshot fetch() {
        String symbol = tradingProperties.symbol();
        List<OhlcvCandle> candles = venueCallExecutor.call(
                "candles",
                () -> priceFeed.fetchCandles(symbol, tradingProperties.timeframe(), requiredCandleCount())
        );
        double lastPrice = venueCallExecutor.call("ticker", () -> priceFeed.lastPrice(symbol));

        List<OhlcvCandle> closed = new ArrayList<>(candles.size());
        OhlcvCandle forming = null;
        for (OhlcvCandle candle : candles) {
            if (candle.closed()) {
                closed.add(candle);
            } else {
                forming = candle;
            }
        }
        return new MarketSnapshot(List.copyOf(closed), forming, lastPrice);
    }

    public Optional<IndicatorFrame> computeIndicators(MarketSnapshot snapshot) {
        Optional<IndicatorFrame> frame = indicatorEngine.compute(snapshot.closedCandles(), indicatorSettings);
        if (frame.isEmpty()) {
            log.info(
                    "event=cycle_skip reason=INSUFFICIENT_HISTORY closed={} required={}",
                    snapshot.closedCandles().size(),
                    indicatorSettings.requiredBars()
            );
        }
        return frame;
    }
}
