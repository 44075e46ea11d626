package org.nowstart.trendband.scheduler;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.trendband.data.exception.VenueException;
import org.nowstart.trendband.data.property.TradingProperties;
import org.nowstart.trendband.data.type.ExecutionMode;
import org.nowstart.trendband.strategy.StrategyRegistry;
import org.nowstart.trendband.venue.MarketMetadata;
import org.nowstart.trendband.venue.VenueGateway;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class TradingStartupValidator {

    private final TradingProperties tradingProperties;
    private final StrategyRegistry strategyRegistry;
    private final VenueGateway venueGateway;

    @PostConstruct
    void validate() {
        strategyRegistry.active();

        if (tradingProperties.executionMode() == ExecutionMode.LIVE && !tradingProperties.hasCredentials()) {
            throw new IllegalStateException("LIVE mode requires OKX api key, secret and passphrase");
        }

        MarketMetadata metadata;
        try {
            metadata = venueGateway.fetchMarketMetadata(tradingProperties.symbol());
        } catch (VenueException e) {
            throw new IllegalStateException("Market metadata unavailable for " + tradingProperties.symbol(), e);
        }

        try {
            venueGateway.configureLeverage(tradingProperties.symbol(), tradingProperties.leverage(), tradingProperties.marginMode());
        } catch (VenueException e) {
            log.warn("event=leverage_setup_failed symbol={} type={} message={}", tradingProperties.symbol(), e.getType(), e.getMessage());
        }

        log.info(
                "event=startup_validated mode={} symbol={} timeframe={} leverage={} quantity_step={} min_quantity={}",
                tradingProperties.executionMode(),
                tradingProperties.symbol(),
                tradingProperties.timeframe(),
                tradingProperties.leverage(),
                metadata.quantityStep(),
                metadata.minQuantity()
        );
    }
}
