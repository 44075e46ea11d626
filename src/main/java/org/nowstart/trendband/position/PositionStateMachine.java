package org.nowstart.trendband.position;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.trendband.data.property.PositionProperties;
import org.nowstart.trendband.data.type.ExitReason;
import org.nowstart.trendband.data.type.PositionSide;
import org.nowstart.trendband.indicator.IndicatorFrame;
import org.nowstart.trendband.indicator.IndicatorPoint;
import org.nowstart.trendband.strategy.core.OhlcvCandle;
import org.nowstart.trendband.venue.VenuePosition;
import org.springframework.stereotype.Component;

/**
 * Lifecycle rules of the single position: FLAT, OPEN(step) and LOCKED.
 *
 * <p>Within one bar the trailing steps are advanced first, from the bar's favorable extreme, and the adverse
 * extreme is then checked against the stop that results. A bar that both advances a step and breaches the new
 * stop therefore exits once, at the new stop price.
 */
@Slf4j
@Component
public class PositionStateMachine {

    private final double stopDistance;
    private final List<PositionProperties.TrailingStep> trailingSteps;
    private final PositionProperties positionProperties;

    public PositionStateMachine(PositionProperties positionProperties) {
        this.positionProperties = positionProperties;
        this.stopDistance = positionProperties.stopDistance().doubleValue();
        this.trailingSteps = positionProperties.trailingSteps();
    }

    public Optional<String> entryBlockReason(TradeState state, IndicatorFrame frame) {
        if (state.getPendingExit() != null) {
            return Optional.of("PENDING_EXIT");
        }
        if (state.hasPosition()) {
            return Optional.of("POSITION_OPEN");
        }
        if (state.isLocked()) {
            return Optional.of("LOCKED");
        }
        if (state.isUnlockedThisCycle()) {
            return Optional.of("UNLOCK_CYCLE");
        }
        if (state.getLastExitAt() != null && frame.barsAfter(state.getLastExitAt()) < positionProperties.cooldownBars()) {
            return Optional.of("COOLDOWN");
        }
        return Optional.empty();
    }

    public double initialStop(PositionSide side, double entryPrice) {
        return entryPrice - side.sign() * stopDistance;
    }

    public double stopFor(PositionSide side, double entryPrice, int step) {
        if (step <= 0) {
            return initialStop(side, entryPrice);
        }
        PositionProperties.TrailingStep trailingStep = trailingSteps.get(Math.min(step, trailingSteps.size()) - 1);
        return entryPrice + side.sign() * trailingStep.stopOffset().doubleValue();
    }

    public OpenPosition open(
            PositionSide side,
            double entryPrice,
            BigDecimal quantity,
            BigDecimal margin,
            Instant openedAt,
            Instant entryBarAt,
            Basket basket
    ) {
        return OpenPosition.builder()
                .side(side)
                .entryPrice(entryPrice)
                .quantity(quantity)
                .stopPrice(basket == null ? initialStop(side, entryPrice) : Double.NaN)
                .trailingStep(0)
                .legCount(1)
                .marginCommitted(margin)
                .openedAt(openedAt)
                .lastLegBarAt(entryBarAt)
                .basket(basket)
                .build();
    }

    public OpenPosition addLeg(OpenPosition position, BasketLeg leg, BigDecimal margin, Instant legBarAt) {
        return position.toBuilder()
                .quantity(position.quantity().add(leg.quantity()))
                .legCount(position.legCount() + 1)
                .marginCommitted(position.marginCommitted().add(margin))
                .lastLegBarAt(legBarAt)
                .basket(position.basket().withLeg(leg))
                .build();
    }

    public OpenPosition refresh(OpenPosition position, VenuePosition venuePosition) {
        double entry = venuePosition.entryPrice() > 0.0 ? venuePosition.entryPrice() : position.entryPrice();
        OpenPosition.OpenPositionBuilder builder = position.toBuilder()
                .quantity(venuePosition.quantity())
                .entryPrice(entry);
        if (!position.isBasket()) {
            builder.stopPrice(stopFor(position.side(), entry, position.trailingStep()));
        }
        return builder.build();
    }

    /**
     * Bar the position is checked against: the forming candle when the position already existed at its open,
     * otherwise a single point at the last price so extremes from before the entry are never used.
     */
    public OhlcvCandle observationBar(OpenPosition position, OhlcvCandle forming, Instant now, double lastPrice) {
        if (forming != null && !position.openedAt().isAfter(forming.timestamp())) {
            return new OhlcvCandle(
                    forming.timestamp(),
                    forming.open(),
                    Math.max(forming.high(), lastPrice),
                    Math.min(forming.low(), lastPrice),
                    lastPrice,
                    forming.volume(),
                    false
            );
        }
        return OhlcvCandle.point(now, lastPrice);
    }

    public PositionDecision evaluate(OpenPosition position, PositionContext context) {
        if (position.isBasket()) {
            return evaluateBasket(position, context);
        }

        OpenPosition stepped = advanceTrailingSteps(position, context.bar());
        PositionSide side = stepped.side();

        double adverse = side == PositionSide.LONG ? context.bar().low() : context.bar().high();
        if (side.sign() * (adverse - stepped.stopPrice()) <= 0.0) {
            double fill = stepped.stopPrice();
            ExitReason reason = stepped.excursion(fill) > 0.0 ? ExitReason.TRAILING_PROFIT : ExitReason.STOP_LOSS;
            return PositionDecision.exit(stepped, reason, fill, "STOP_BREACH step=" + stepped.trailingStep());
        }

        if (positionProperties.envelopeTakeProfit()) {
            IndicatorPoint latest = context.latest();
            double favorable = side == PositionSide.LONG ? context.bar().high() : context.bar().low();
            double band = side == PositionSide.LONG ? latest.envelopeUpper() : latest.envelopeLower();
            if (side.sign() * (favorable - band) >= 0.0) {
                return PositionDecision.exit(stepped, ExitReason.TAKE_PROFIT, band, "ENVELOPE_TARGET");
            }
        }

        Optional<String> flip = trendFlip(side, context);
        if (flip.isPresent()) {
            return PositionDecision.exit(stepped, ExitReason.TREND_FLIP, context.currentPrice(), flip.get());
        }
        return PositionDecision.hold(stepped);
    }

    private PositionDecision evaluateBasket(OpenPosition position, PositionContext context) {
        Basket basket = position.basket();
        BigDecimal equity = context.totalEquity();
        if (equity != null) {
            if (equity.compareTo(basket.targetEquity()) >= 0) {
                return PositionDecision.exit(position, ExitReason.BASKET_TARGET, context.currentPrice(), "EQUITY_TARGET");
            }
            if (equity.compareTo(basket.stopEquity()) <= 0) {
                return PositionDecision.exit(position, ExitReason.BASKET_STOP, context.currentPrice(), "EQUITY_STOP");
            }
        }

        Optional<String> flip = trendFlip(position.side(), context);
        if (flip.isPresent()) {
            return PositionDecision.exit(position, ExitReason.TREND_FLIP, context.currentPrice(), flip.get());
        }

        if (position.legCount() < context.maxLegs() && addLegConfirmed(position, context)) {
            return PositionDecision.addLeg(position, "EMA_FAST_RECROSS");
        }
        return PositionDecision.hold(position);
    }

    OpenPosition advanceTrailingSteps(OpenPosition position, OhlcvCandle bar) {
        double favorable = position.side() == PositionSide.LONG ? bar.high() : bar.low();
        double excursion = position.excursion(favorable);

        int step = position.trailingStep();
        while (step < trailingSteps.size() && excursion >= trailingSteps.get(step).trigger().doubleValue()) {
            step++;
        }
        if (step == position.trailingStep()) {
            return position;
        }

        double stop = stopFor(position.side(), position.entryPrice(), step);
        log.info("event=trailing_step side={} step={} stop={} excursion={}", position.side(), step, stop, excursion);
        return position.withTrailingStep(step, stop);
    }

    private Optional<String> trendFlip(PositionSide side, PositionContext context) {
        if (positionProperties.closeOnTrendFlip() && context.trend().opposes(side)) {
            return Optional.of("TREND_AGAINST_POSITION");
        }
        if (context.signal() != null && context.signal().direction().opposes(side)) {
            return Optional.of("OPPOSING_SIGNAL");
        }
        return Optional.empty();
    }

    boolean addLegConfirmed(OpenPosition position, PositionContext context) {
        IndicatorPoint previous = context.previous();
        IndicatorPoint latest = context.latest();
        if (previous == null || latest == null) {
            return false;
        }
        if (position.lastLegBarAt() != null && !latest.timestamp().isAfter(position.lastLegBarAt())) {
            return false;
        }

        int sign = position.side().sign();
        boolean pulledBack = sign * (previous.close() - previous.emaFast()) <= 0.0;
        boolean recrossed = sign * (latest.close() - latest.emaFast()) > 0.0;
        boolean trendSide = sign * (latest.emaFast() - latest.emaSlow()) > 0.0;
        return pulledBack && recrossed && trendSide;
    }

    public BigDecimal realizedPnl(OpenPosition position, double exitPrice) {
        double perUnit = position.side().sign() * (exitPrice - position.entryPrice());
        return BigDecimal.valueOf(perUnit).multiply(position.quantity());
    }

    public BigDecimal basketPnl(OpenPosition position, BigDecimal equityNow) {
        return equityNow.subtract(position.basket().equityAtOpen());
    }

    /**
     * Stop exits are named after the realized sign, not after the step that produced the stop.
     */
    public ExitReason settleReason(ExitReason decided, BigDecimal realizedPnl) {
        if (decided == ExitReason.STOP_LOSS || decided == ExitReason.TRAILING_PROFIT) {
            return realizedPnl.signum() > 0 ? ExitReason.TRAILING_PROFIT : ExitReason.STOP_LOSS;
        }
        return decided;
    }

    public boolean onExitConfirmed(TradeState state, ExitReason reason, Instant latestClosedBarAt) {
        state.clearPosition();
        state.setLastExitAt(latestClosedBarAt);
        if (positionProperties.lockAfterStopLoss() && reason.isStopLoss()) {
            state.setLocked(true);
            state.setLockedAfter(latestClosedBarAt);
            log.info("event=sl_lock reason={} lockedAfter={}", reason, latestClosedBarAt);
            return true;
        }
        return false;
    }

    /**
     * Releases the lock when a bar closed after the stop settles inside the envelope. Intrabar prices are never
     * considered.
     */
    public boolean tryUnlock(TradeState state, IndicatorPoint latestClosed) {
        if (!state.isLocked()) {
            return false;
        }
        if (state.getLockedAfter() != null && !latestClosed.timestamp().isAfter(state.getLockedAfter())) {
            return false;
        }
        if (!latestClosed.insideEnvelope(latestClosed.close())) {
            return false;
        }

        state.setLocked(false);
        state.setLockedAfter(null);
        state.setUnlockedThisCycle(true);
        log.info("event=sl_unlock close={} lower={} upper={}", latestClosed.close(), latestClosed.envelopeLower(), latestClosed.envelopeUpper());
        return true;
    }
}
