package org.nowstart.trendband.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.trendband.data.property.RiskProperties;
import org.nowstart.trendband.data.property.TradingProperties;
import org.nowstart.trendband.position.Basket;
import org.nowstart.trendband.position.BasketLeg;
import org.nowstart.trendband.position.OpenPosition;
import org.nowstart.trendband.position.PositionStateMachine;
import org.nowstart.trendband.position.TradeState;
import org.nowstart.trendband.risk.RiskSizer;
import org.nowstart.trendband.venue.EquitySnapshot;
import org.nowstart.trendband.venue.NotificationSink;
import org.nowstart.trendband.venue.VenueCallExecutor;
import org.nowstart.trendband.venue.VenueGateway;
import org.nowstart.trendband.venue.VenuePosition;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class TradingPositionSyncService {

    private final VenueGateway venueGateway;
    private final VenueCallExecutor venueCallExecutor;
    private final PositionStateMachine positionStateMachine;
    private final RiskSizer riskSizer;
    private final RiskProperties riskProperties;
    private final TradingProperties tradingProperties;
    private final NotificationSink notificationSink;

    public SyncOutcome reconcile(TradeState state, Instant latestClosedBarAt, Instant now) {
        String symbol = tradingProperties.symbol();
        Optional<VenuePosition> venuePosition = venueCallExecutor.call("position", () -> venueGateway.fetchPosition(symbol));
        OpenPosition local = state.getPosition();

        if (local == null && venuePosition.isEmpty()) {
            return SyncOutcome.IN_SYNC;
        }

        if (local != null && venuePosition.isEmpty()) {
            if (state.getPendingExit() != null) {
                log.info("event=position_sync symbol={} outcome=EXIT_CONFIRMED reason={}", symbol, state.getPendingExit().reason());
                return SyncOutcome.EXIT_CONFIRMED;
            }
            state.clearPosition();
            state.setLastExitAt(latestClosedBarAt);
            log.warn(
                    "event=position_sync symbol={} outcome=LOCAL_CORRECTED local_side={} local_qty={} venue=NONE",
                    symbol,
                    local.side(),
                    local.quantity()
            );
            notificationSink.send("Position " + local.side() + " " + symbol + " closed outside the bot; local state set to FLAT");
            return SyncOutcome.LOCAL_CORRECTED;
        }

        VenuePosition venue = venuePosition.get();
        if (local == null || local.side() != venue.side()) {
            OpenPosition adopted = adopt(venue, latestClosedBarAt, now);
            state.setPosition(adopted);
            state.setPendingExit(null);
            state.setLocked(false);
            state.setLockedAfter(null);
            log.warn(
                    "event=position_sync symbol={} outcome=ADOPTED venue_side={} venue_qty={} venue_entry={} replaced_side={}",
                    symbol,
                    venue.side(),
                    venue.quantity(),
                    venue.entryPrice(),
                    local == null ? "NONE" : local.side()
            );
            notificationSink.send("Adopted venue position " + venue.side() + " " + venue.quantity() + " " + symbol + " @ " + venue.entryPrice());
            return SyncOutcome.ADOPTED;
        }

        OpenPosition refreshed = positionStateMachine.refresh(local, venue);
        state.setPosition(refreshed);
        log.debug(
                "event=position_sync symbol={} outcome=REFRESHED side={} qty={} entry={} stop={} step={}",
                symbol,
                refreshed.side(),
                refreshed.quantity(),
                refreshed.entryPrice(),
                refreshed.stopPrice(),
                refreshed.trailingStep()
        );
        return SyncOutcome.REFRESHED;
    }

    private OpenPosition adopt(VenuePosition venue, Instant latestClosedBarAt, Instant now) {
        Basket basket = null;
        if (riskSizer.usesBaskets()) {
            EquitySnapshot equity = venueCallExecutor.call("equity", venueGateway::fetchEquity);
            BigDecimal unrealized = venue.unrealizedPnl() == null ? BigDecimal.ZERO : venue.unrealizedPnl();
            basket = Basket.open(
                    equity.total().subtract(unrealized),
                    riskProperties.basketTargetFraction(),
                    riskProperties.basketStopFraction(),
                    new BasketLeg(venue.entryPrice(), venue.quantity())
            );
        }
        return positionStateMachine.open(
                venue.side(),
                venue.entryPrice(),
                venue.quantity(),
                BigDecimal.ZERO,
                now,
                latestClosedBarAt,
                basket
        );
    }
}
