package org.nowstart.trendband.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.trendband.accounting.ClosedTrade;
import org.nowstart.trendband.accounting.DailyAccounting;
import org.nowstart.trendband.accounting.DailyReportService;
import org.nowstart.trendband.data.dto.MarketSnapshot;
import org.nowstart.trendband.data.exception.VenueException;
import org.nowstart.trendband.data.property.RiskProperties;
import org.nowstart.trendband.data.property.TradingProperties;
import org.nowstart.trendband.data.type.ExitReason;
import org.nowstart.trendband.data.type.PositionSide;
import org.nowstart.trendband.indicator.IndicatorFrame;
import org.nowstart.trendband.indicator.IndicatorPoint;
import org.nowstart.trendband.position.Basket;
import org.nowstart.trendband.position.BasketLeg;
import org.nowstart.trendband.position.OpenPosition;
import org.nowstart.trendband.position.PendingExit;
import org.nowstart.trendband.position.PositionContext;
import org.nowstart.trendband.position.PositionDecision;
import org.nowstart.trendband.position.PositionStateMachine;
import org.nowstart.trendband.position.TradeState;
import org.nowstart.trendband.position.TradeStateSnapshot;
import org.nowstart.trendband.risk.RiskSizer;
import org.nowstart.trendband.risk.SizingRequest;
import org.nowstart.trendband.risk.SizingResult;
import org.nowstart.trendband.strategy.StrategyRegistry;
import org.nowstart.trendband.strategy.core.OhlcvCandle;
import org.nowstart.trendband.strategy.core.Signal;
import org.nowstart.trendband.strategy.core.StrategyEvaluation;
import org.nowstart.trendband.strategy.core.StrategyInput;
import org.nowstart.trendband.venue.EquitySnapshot;
import org.nowstart.trendband.venue.MarketMetadata;
import org.nowstart.trendband.venue.NotificationSink;
import org.nowstart.trendband.venue.OrderRequest;
import org.nowstart.trendband.venue.OrderResult;
import org.nowstart.trendband.venue.VenueCallExecutor;
import org.nowstart.trendband.venue.VenueGateway;
import org.nowstart.trendband.venue.VenuePosition;
import org.springframework.stereotype.Service;

/**
 * One decision cycle: daily rollover, market data, indicators, signal, venue sync, position management and
 * entry. The {@link TradeState} is owned here and only touched from {@link #runOnce()}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingCycleService {

    private final TradingProperties tradingProperties;
    private final RiskProperties riskProperties;
    private final TradingSignalMarketDataService tradingSignalMarketDataService;
    private final StrategyRegistry strategyRegistry;
    private final TradingPositionSyncService tradingPositionSyncService;
    private final TradingSignalOrderService tradingSignalOrderService;
    private final PositionStateMachine positionStateMachine;
    private final RiskSizer riskSizer;
    private final DailyAccounting dailyAccounting;
    private final DailyReportService dailyReportService;
    private final VenueGateway venueGateway;
    private final VenueCallExecutor venueCallExecutor;
    private final NotificationSink notificationSink;
    private final Clock clock;

    private final TradeState state = new TradeState();
    private volatile TradeStateSnapshot snapshot = TradeStateSnapshot.initial();

    public TradeStateSnapshot snapshot() {
        return snapshot;
    }

    public void runOnce() {
        try {
            runCycle(clock.instant());
        } catch (VenueException e) {
            if (e.isTransient()) {
                log.warn("event=cycle_abandoned type={} code={} message={}", e.getType(), e.getCode(), e.getMessage());
            } else {
                log.error("event=cycle_abandoned type={} code={} message={}", e.getType(), e.getCode(), e.getMessage(), e);
            }
        } catch (RuntimeException e) {
            log.error("event=cycle_failed message={}", e.getMessage(), e);
        } finally {
            snapshot = state.snapshot();
        }
    }

    TradeState state() {
        return state;
    }

    private void runCycle(Instant now) {
        state.setUnlockedThisCycle(false);
        dailyAccounting.rollIfNewDay().ifPresent(dailyReportService::onRollover);
        dailyReportService.sendIfDue();

        MarketSnapshot market = tradingSignalMarketDataService.fetch();
        Optional<IndicatorFrame> frameOpt = tradingSignalMarketDataService.computeIndicators(market);
        if (frameOpt.isEmpty()) {
            return;
        }
        IndicatorFrame frame = frameOpt.get();
        Optional<IndicatorPoint> latestOpt = frame.point(frame.size() - 1);
        Optional<IndicatorPoint> previousOpt = frame.point(frame.size() - 2);
        if (latestOpt.isEmpty() || previousOpt.isEmpty()) {
            log.info("event=cycle_skip reason=UNDEFINED_INDICATORS bars={}", frame.size());
            return;
        }
        IndicatorPoint latest = latestOpt.get();
        IndicatorPoint previous = previousOpt.get();
        double price = market.lastPrice();

        StrategyEvaluation evaluation = strategyRegistry.active().evaluate(new StrategyInput(frame, price));
        log.info(
                "event=cycle_signal symbol={} bar={} price={} ema_fast={} ema_slow={} atr={} env_lower={} env_upper={} trend={} signal={} reason={} phase={}",
                tradingProperties.symbol(),
                latest.timestamp(),
                price,
                latest.emaFast(),
                latest.emaSlow(),
                latest.atr(),
                latest.envelopeLower(),
                latest.envelopeUpper(),
                evaluation.trend(),
                evaluation.signal().direction(),
                evaluation.signal().reason(),
                state.phase()
        );

        SyncOutcome sync = tradingPositionSyncService.reconcile(state, latest.timestamp(), now);
        if (sync == SyncOutcome.EXIT_CONFIRMED) {
            PendingExit pending = state.getPendingExit();
            finalizeExit(state.getPosition(), pending.reason(), pending.decisionPrice(), null, latest.timestamp(), now);
            return;
        }

        if (state.getPendingExit() != null) {
            retryPendingExit(price, latest.timestamp(), now);
            return;
        }

        if (state.hasPosition()) {
            managePosition(market, previous, latest, evaluation, now);
            return;
        }

        if (state.isLocked()) {
            if (!positionStateMachine.tryUnlock(state, latest)) {
                return;
            }
            notificationSink.send("Stop-loss lock released: " + tradingProperties.symbol() + " closed at " + latest.close() + " inside the envelope");
        }

        tryEnter(frame, latest, evaluation.signal(), price, now);
    }

    private void managePosition(
            MarketSnapshot market,
            IndicatorPoint previous,
            IndicatorPoint latest,
            StrategyEvaluation evaluation,
            Instant now
    ) {
        OpenPosition position = state.getPosition();
        double price = market.lastPrice();
        EquitySnapshot equity = position.isBasket() ? venueCallExecutor.call("equity", venueGateway::fetchEquity) : null;
        BigDecimal totalEquity = equity == null ? null : equity.total();
        int maxLegs = position.isBasket() ? riskSizer.maxLegs(totalEquity) : 1;

        OhlcvCandle bar = positionStateMachine.observationBar(position, market.forming(), now, price);
        PositionDecision decision = positionStateMachine.evaluate(position, new PositionContext(
                bar,
                price,
                previous,
                latest,
                evaluation.trend(),
                evaluation.signal(),
                totalEquity,
                maxLegs
        ));
        state.setPosition(decision.position());

        if (decision.isExit()) {
            exitPosition(decision, price, latest.timestamp(), now);
        } else if (decision.isAddLeg()) {
            addLeg(decision.position(), equity, price, latest.timestamp());
        }
    }

    private void exitPosition(PositionDecision decision, double price, Instant latestClosedBarAt, Instant now) {
        OpenPosition position = decision.position();
        log.info(
                "event=position_exit_request side={} reason={} detail={} exit_price={} price={} stop={} step={}",
                position.side(),
                decision.exitReason(),
                decision.detail(),
                decision.exitPrice(),
                price,
                position.stopPrice(),
                position.trailingStep()
        );

        ExitAttempt attempt = tradingSignalOrderService.closePosition(referencePrice(decision.exitReason(), decision.exitPrice(), price));
        if (attempt.confirmed()) {
            finalizeExit(position, decision.exitReason(), decision.exitPrice(), attempt.order(), latestClosedBarAt, now);
            return;
        }

        state.setPendingExit(new PendingExit(decision.exitReason(), decision.exitPrice(), now));
        notificationSink.send("Exit not confirmed for " + tradingProperties.symbol() + " (" + decision.exitReason() + "); retrying next cycle");
    }

    private void retryPendingExit(double price, Instant latestClosedBarAt, Instant now) {
        PendingExit pending = state.getPendingExit();
        log.info("event=pending_exit_retry reason={} requested_at={}", pending.reason(), pending.requestedAt());
        ExitAttempt attempt = tradingSignalOrderService.closePosition(referencePrice(pending.reason(), pending.decisionPrice(), price));
        if (attempt.confirmed()) {
            finalizeExit(state.getPosition(), pending.reason(), pending.decisionPrice(), attempt.order(), latestClosedBarAt, now);
        }
    }

    private static double referencePrice(ExitReason reason, double decisionPrice, double lastPrice) {
        return reason.isStopPriced() ? decisionPrice : lastPrice;
    }

    private void finalizeExit(
            OpenPosition position,
            ExitReason decided,
            double decisionPrice,
            OrderResult order,
            Instant latestClosedBarAt,
            Instant now
    ) {
        double fill = decided.isStopPriced() || order == null || !order.hasFillPrice() ? decisionPrice : order.avgPrice();
        BigDecimal pnl;
        if (position.isBasket()) {
            EquitySnapshot equity = venueCallExecutor.call("equity", venueGateway::fetchEquity);
            pnl = positionStateMachine.basketPnl(position, equity.total());
        } else {
            pnl = positionStateMachine.realizedPnl(position, fill);
        }

        ExitReason reason = positionStateMachine.settleReason(decided, pnl);
        boolean locked = positionStateMachine.onExitConfirmed(state, reason, latestClosedBarAt);
        boolean halted = dailyAccounting.recordExit(new ClosedTrade(
                now,
                position.side(),
                position.entryPrice(),
                fill,
                position.quantity(),
                pnl,
                reason
        ));

        log.info(
                "event=position_close side={} entry={} exit={} qty={} legs={} pnl={} reason={} locked={} halted={}",
                position.side(),
                position.entryPrice(),
                fill,
                position.quantity(),
                position.legCount(),
                pnl,
                reason,
                locked,
                halted
        );
        notificationSink.send("Closed " + position.side() + " " + tradingProperties.symbol()
                + " " + position.entryPrice() + " -> " + fill + " pnl=" + pnl.toPlainString() + " (" + reason + ")");
        if (locked) {
            notificationSink.send("Stop-loss lock active: waiting for a closed bar inside the envelope");
        }
        if (halted) {
            notificationSink.send("Daily loss streak limit reached; entries halted until tomorrow");
        }
    }

    private void addLeg(OpenPosition position, EquitySnapshot equity, double price, Instant latestClosedBarAt) {
        MarketMetadata metadata = venueCallExecutor.call("metadata", () -> venueGateway.fetchMarketMetadata(tradingProperties.symbol()));
        SizingResult sizing = riskSizer.size(new SizingRequest(
                equity.free(),
                equity.total(),
                price,
                Double.NaN,
                position.legCount(),
                metadata
        ));
        if (!sizing.tradable()) {
            log.info("event=basket_add_leg_skipped reason={} legs={} max_legs={}", sizing.reason(), position.legCount(), sizing.maxLegs());
            return;
        }

        OrderResult result = tradingSignalOrderService.submitEntry(
                OrderRequest.open(tradingProperties.symbol(), position.side(), sizing.quantity(), price),
                metadata
        );
        if (!result.isSuccess()) {
            log.warn("event=basket_add_leg_failed type={} message={}", result.errorType(), result.message());
            return;
        }

        BigDecimal filled = result.quantity() != null && result.quantity().signum() > 0 ? result.quantity() : sizing.quantity();
        double legPrice = result.hasFillPrice() ? result.avgPrice() : price;
        OpenPosition updated = positionStateMachine.addLeg(position, new BasketLeg(legPrice, filled), sizing.margin(), latestClosedBarAt);
        state.setPosition(updated);
        log.info("event=basket_add_leg side={} leg={} qty={} price={} total_qty={}", updated.side(), updated.legCount(), filled, legPrice, updated.quantity());
        notificationSink.send("Added leg " + updated.legCount() + " " + updated.side() + " " + tradingProperties.symbol() + " qty=" + filled + " @ " + legPrice);
    }

    private void tryEnter(IndicatorFrame frame, IndicatorPoint latest, Signal signal, double price, Instant now) {
        if (!signal.isActionable()) {
            return;
        }
        Optional<String> blocked = positionStateMachine.entryBlockReason(state, frame).or(dailyAccounting::entryBlockReason);
        if (blocked.isPresent()) {
            log.info("event=entry_blocked signal={} reason={}", signal.direction(), blocked.get());
            return;
        }

        PositionSide side = PositionSide.fromDirection(signal.direction());
        String symbol = tradingProperties.symbol();
        MarketMetadata metadata = venueCallExecutor.call("metadata", () -> venueGateway.fetchMarketMetadata(symbol));
        EquitySnapshot equity = venueCallExecutor.call("equity", venueGateway::fetchEquity);
        SizingResult sizing = riskSizer.size(new SizingRequest(
                equity.free(),
                equity.total(),
                price,
                positionStateMachine.initialStop(side, price),
                0,
                metadata
        ));
        if (!sizing.tradable()) {
            log.info("event=entry_skipped signal={} reason={} notional={}", signal.direction(), sizing.reason(), sizing.notional());
            return;
        }

        OrderResult result = tradingSignalOrderService.submitEntry(OrderRequest.open(symbol, side, sizing.quantity(), price), metadata);
        if (!result.isSuccess()) {
            log.warn("event=entry_failed signal={} type={} message={}", signal.direction(), result.errorType(), result.message());
            return;
        }

        Optional<VenuePosition> confirmed = tradingSignalOrderService.confirmEntry(side);
        if (confirmed.isEmpty()) {
            log.warn("event=entry_unconfirmed signal={} order_id={}", signal.direction(), result.orderId());
            return;
        }

        VenuePosition venue = confirmed.get();
        double entry = venue.entryPrice() > 0.0 ? venue.entryPrice() : (result.hasFillPrice() ? result.avgPrice() : price);
        Basket basket = riskSizer.usesBaskets()
                ? Basket.open(
                        equity.total(),
                        riskProperties.basketTargetFraction(),
                        riskProperties.basketStopFraction(),
                        new BasketLeg(entry, venue.quantity())
                )
                : null;
        OpenPosition position = positionStateMachine.open(side, entry, venue.quantity(), sizing.margin(), now, latest.timestamp(), basket);
        state.setPosition(position);
        dailyAccounting.recordEntry();

        log.info(
                "event=position_open side={} entry={} qty={} stop={} margin={} policy={} reason={}",
                side,
                entry,
                venue.quantity(),
                position.stopPrice(),
                sizing.margin(),
                riskSizer.activePolicy(),
                signal.reason()
        );
        notificationSink.send("Opened " + side + " " + symbol + " qty=" + venue.quantity() + " @ " + entry
                + (position.isBasket() ? "" : " stop=" + position.stopPrice()) + " (" + signal.reason() + ")");
    }
}
