package org.nowstart.trendband.position;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.nowstart.trendband.indicator.IndicatorFrames.bar;
import static org.nowstart.trendband.indicator.IndicatorFrames.point;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.trendband.data.type.ExitReason;
import org.nowstart.trendband.data.type.PositionPhase;
import org.nowstart.trendband.data.type.PositionSide;
import org.nowstart.trendband.data.type.SignalDirection;
import org.nowstart.trendband.data.type.StrategyVariant;
import org.nowstart.trendband.data.type.TrendDirection;
import org.nowstart.trendband.indicator.IndicatorFrame;
import org.nowstart.trendband.indicator.IndicatorFrames;
import org.nowstart.trendband.indicator.IndicatorPoint;
import org.nowstart.trendband.strategy.core.OhlcvCandle;
import org.nowstart.trendband.strategy.core.Signal;
import org.nowstart.trendband.support.TestProperties;
import org.nowstart.trendband.venue.VenuePosition;

class PositionStateMachineTest {

    private static final IndicatorPoint WIDE_BAND = point(3, 100.0, 100.0, 100.0, 50.0, 200.0);

    private final PositionStateMachine machine = new PositionStateMachine(TestProperties.position(
            "10",
            List.of(TestProperties.step("10", "-5"), TestProperties.step("20", "5")),
            2,
            true
    ));

    @Test
    void evaluate_stopBreachExitsAtStopPrice() {
        OpenPosition position = longAt(100.0);

        PositionDecision decision = machine.evaluate(position, context(candle(101.0, 85.0), 86.0, TrendDirection.NONE));

        assertThat(decision.isExit()).isTrue();
        assertThat(decision.exitPrice()).isEqualTo(90.0);
        assertThat(decision.exitReason()).isEqualTo(ExitReason.STOP_LOSS);
        assertThat(decision.detail()).isEqualTo("STOP_BREACH step=0");
    }

    @Test
    void evaluate_shortStopBreachUsesBarHigh() {
        OpenPosition position = machine.open(PositionSide.SHORT, 100.0, BigDecimal.ONE, BigDecimal.TEN, bar(0), bar(0), null);

        PositionDecision decision = machine.evaluate(position, context(candle(112.0, 99.0), 111.0, TrendDirection.NONE));

        assertThat(decision.exitPrice()).isEqualTo(110.0);
        assertThat(decision.exitReason()).isEqualTo(ExitReason.STOP_LOSS);
    }

    @Test
    void evaluate_stepAndBreachInSameBarExitOnceAtNewStop() {
        OpenPosition position = longAt(100.0);

        PositionDecision decision = machine.evaluate(position, context(candle(121.0, 94.0), 95.0, TrendDirection.NONE));

        assertThat(decision.isExit()).isTrue();
        assertThat(decision.position().trailingStep()).isEqualTo(2);
        assertThat(decision.exitPrice()).isEqualTo(105.0);
        assertThat(decision.exitReason()).isEqualTo(ExitReason.TRAILING_PROFIT);
    }

    @Test
    void evaluate_firstStepMovesStopWithoutExit() {
        OpenPosition position = longAt(100.0);

        PositionDecision decision = machine.evaluate(position, context(candle(111.0, 99.0), 110.0, TrendDirection.NONE));

        assertThat(decision.isExit()).isFalse();
        assertThat(decision.position().trailingStep()).isEqualTo(1);
        assertThat(decision.position().stopPrice()).isEqualTo(95.0);
    }

    @Test
    void evaluate_trailingStepNeverMovesBack() {
        OpenPosition stepped = longAt(100.0).withTrailingStep(2, 105.0);

        PositionDecision decision = machine.evaluate(stepped, context(candle(106.0, 105.5), 106.0, TrendDirection.NONE));

        assertThat(decision.position().trailingStep()).isEqualTo(2);
        assertThat(decision.position().stopPrice()).isEqualTo(105.0);
        assertThatThrownBy(() -> stepped.withTrailingStep(1, 95.0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void evaluate_opposingEnvelopeBandTakesProfit() {
        OpenPosition position = longAt(100.0);
        IndicatorPoint narrow = point(3, 100.0, 100.0, 100.0, 90.0, 107.0);
        PositionContext context = new PositionContext(
                candle(108.0, 99.5), 107.5, narrow, narrow, TrendDirection.NONE, null, null, 1);

        PositionDecision decision = machine.evaluate(position, context);

        assertThat(decision.exitReason()).isEqualTo(ExitReason.TAKE_PROFIT);
        assertThat(decision.exitPrice()).isEqualTo(107.0);
    }

    @Test
    void evaluate_trendFlipClosesAtCurrentPrice() {
        PositionDecision decision = machine.evaluate(longAt(100.0), context(candle(101.0, 99.0), 100.5, TrendDirection.DOWN));

        assertThat(decision.exitReason()).isEqualTo(ExitReason.TREND_FLIP);
        assertThat(decision.exitPrice()).isEqualTo(100.5);
        assertThat(decision.detail()).isEqualTo("TREND_AGAINST_POSITION");
    }

    @Test
    void evaluate_opposingSignalClosesPosition() {
        PositionContext context = new PositionContext(
                candle(101.0, 99.0),
                100.5,
                WIDE_BAND,
                WIDE_BAND,
                TrendDirection.NONE,
                Signal.of(SignalDirection.SHORT, StrategyVariant.ENVELOPE_TOUCH, "UPPER_BAND_TOUCH"),
                null,
                1
        );

        PositionDecision decision = machine.evaluate(longAt(100.0), context);

        assertThat(decision.exitReason()).isEqualTo(ExitReason.TREND_FLIP);
        assertThat(decision.detail()).isEqualTo("OPPOSING_SIGNAL");
    }

    @Test
    void evaluate_basketExitsOnEquityTargetAndStop() {
        OpenPosition basket = basketLong(bar(0));

        PositionDecision target = machine.evaluate(basket, basketContext(new BigDecimal("1020"), WIDE_BAND, WIDE_BAND, 2));
        PositionDecision stop = machine.evaluate(basket, basketContext(new BigDecimal("970"), WIDE_BAND, WIDE_BAND, 2));
        PositionDecision hold = machine.evaluate(basket, basketContext(new BigDecimal("1000"), WIDE_BAND, WIDE_BAND, 2));

        assertThat(target.exitReason()).isEqualTo(ExitReason.BASKET_TARGET);
        assertThat(stop.exitReason()).isEqualTo(ExitReason.BASKET_STOP);
        assertThat(hold.isExit()).isFalse();
        assertThat(basket.stopPrice()).isNaN();
    }

    @Test
    void evaluate_basketAddsLegOnFastEmaRecross() {
        IndicatorPoint pullback = point(1, 99.0, 100.0, 98.0, 50.0, 200.0);
        IndicatorPoint recross = point(2, 101.0, 100.0, 98.0, 50.0, 200.0);

        PositionDecision decision = machine.evaluate(basketLong(bar(0)), basketContext(new BigDecimal("1000"), pullback, recross, 2));

        assertThat(decision.isAddLeg()).isTrue();
        assertThat(decision.detail()).isEqualTo("EMA_FAST_RECROSS");
    }

    @Test
    void evaluate_basketAddsAtMostOneLegPerClosedBar() {
        IndicatorPoint pullback = point(1, 99.0, 100.0, 98.0, 50.0, 200.0);
        IndicatorPoint recross = point(2, 101.0, 100.0, 98.0, 50.0, 200.0);

        PositionDecision sameBar = machine.evaluate(basketLong(bar(2)), basketContext(new BigDecimal("1000"), pullback, recross, 3));
        PositionDecision atLimit = machine.evaluate(basketLong(bar(0)), basketContext(new BigDecimal("1000"), pullback, recross, 1));

        assertThat(sameBar.isAddLeg()).isFalse();
        assertThat(atLimit.isAddLeg()).isFalse();
    }

    @Test
    void addLeg_accumulatesQuantityMarginAndLegs() {
        OpenPosition basket = basketLong(bar(0));

        OpenPosition next = machine.addLeg(basket, new BasketLeg(101.0, new BigDecimal("0.15")), BigDecimal.ONE, bar(2));

        assertThat(next.legCount()).isEqualTo(2);
        assertThat(next.quantity()).isEqualByComparingTo("0.30");
        assertThat(next.marginCommitted()).isEqualByComparingTo("2");
        assertThat(next.lastLegBarAt()).isEqualTo(bar(2));
        assertThat(next.basket().legs()).hasSize(2);
    }

    @Test
    void onExitConfirmed_stopLossLocksUntilClosedBarInsideEnvelope() {
        TradeState state = new TradeState();
        state.setPosition(longAt(100.0));

        boolean locked = machine.onExitConfirmed(state, ExitReason.STOP_LOSS, bar(5));

        assertThat(locked).isTrue();
        assertThat(state.phase()).isEqualTo(PositionPhase.LOCKED);
        assertThat(machine.entryBlockReason(state, frameUpTo(5))).contains("LOCKED");

        assertThat(machine.tryUnlock(state, point(5, 100.0, 100.0, 100.0, 90.0, 110.0))).isFalse();
        assertThat(machine.tryUnlock(state, point(6, 120.0, 100.0, 100.0, 90.0, 110.0))).isFalse();
        assertThat(machine.tryUnlock(state, point(7, 110.0, 100.0, 100.0, 90.0, 110.0))).isTrue();

        assertThat(state.phase()).isEqualTo(PositionPhase.FLAT);
        assertThat(machine.entryBlockReason(state, frameUpTo(7))).contains("UNLOCK_CYCLE");
    }

    @Test
    void onExitConfirmed_profitableExitLeavesFlat() {
        TradeState state = new TradeState();
        state.setPosition(longAt(100.0));
        state.setPendingExit(new PendingExit(ExitReason.TAKE_PROFIT, 107.0, Instant.EPOCH));

        boolean locked = machine.onExitConfirmed(state, ExitReason.TAKE_PROFIT, bar(5));

        assertThat(locked).isFalse();
        assertThat(state.phase()).isEqualTo(PositionPhase.FLAT);
        assertThat(state.getPendingExit()).isNull();
        assertThat(state.getLastExitAt()).isEqualTo(bar(5));
    }

    @Test
    void entryBlockReason_enforcesCooldownBars() {
        TradeState state = new TradeState();
        state.setLastExitAt(bar(5));

        assertThat(machine.entryBlockReason(state, frameUpTo(6))).contains("COOLDOWN");
        assertThat(machine.entryBlockReason(state, frameUpTo(7))).isEmpty();
    }

    @Test
    void entryBlockReason_pendingExitTakesPrecedence() {
        TradeState state = new TradeState();
        state.setPosition(longAt(100.0));
        state.setPendingExit(new PendingExit(ExitReason.STOP_LOSS, 90.0, Instant.EPOCH));

        assertThat(machine.entryBlockReason(state, frameUpTo(3))).contains("PENDING_EXIT");
    }

    @Test
    void settleReason_namesStopExitsByRealizedSign() {
        assertThat(machine.settleReason(ExitReason.STOP_LOSS, new BigDecimal("0.5"))).isEqualTo(ExitReason.TRAILING_PROFIT);
        assertThat(machine.settleReason(ExitReason.TRAILING_PROFIT, BigDecimal.ZERO)).isEqualTo(ExitReason.STOP_LOSS);
        assertThat(machine.settleReason(ExitReason.TAKE_PROFIT, new BigDecimal("-1"))).isEqualTo(ExitReason.TAKE_PROFIT);
    }

    @Test
    void realizedPnl_followsPositionSide() {
        OpenPosition shortPosition = machine.open(PositionSide.SHORT, 100.0, new BigDecimal("0.5"), BigDecimal.TEN, bar(0), bar(0), null);

        assertThat(machine.realizedPnl(longAt(100.0), 90.0)).isEqualByComparingTo("-10");
        assertThat(machine.realizedPnl(shortPosition, 90.0)).isEqualByComparingTo("5");
    }

    @Test
    void refresh_rederivesStopFromVenueEntry() {
        OpenPosition refreshed = machine.refresh(
                longAt(100.0),
                new VenuePosition(PositionSide.LONG, new BigDecimal("2"), 102.0, BigDecimal.ZERO)
        );

        assertThat(refreshed.entryPrice()).isEqualTo(102.0);
        assertThat(refreshed.stopPrice()).isEqualTo(92.0);
        assertThat(refreshed.quantity()).isEqualByComparingTo("2");
    }

    @Test
    void observationBar_ignoresExtremesFromBeforeEntry() {
        OhlcvCandle forming = new OhlcvCandle(bar(4), 100.0, 130.0, 70.0, 100.0, 1.0, false);
        OpenPosition existing = machine.open(PositionSide.LONG, 100.0, BigDecimal.ONE, BigDecimal.TEN, bar(3), bar(3), null);
        OpenPosition fresh = machine.open(PositionSide.LONG, 100.0, BigDecimal.ONE, BigDecimal.TEN, bar(4).plusSeconds(60), bar(3), null);
        Instant now = bar(4).plusSeconds(120);

        OhlcvCandle extended = machine.observationBar(existing, forming, now, 131.0);
        OhlcvCandle single = machine.observationBar(fresh, forming, now, 101.0);

        assertThat(extended.high()).isEqualTo(131.0);
        assertThat(extended.low()).isEqualTo(70.0);
        assertThat(single.high()).isEqualTo(101.0);
        assertThat(single.low()).isEqualTo(101.0);
        assertThat(single.timestamp()).isEqualTo(now);
    }

    private OpenPosition longAt(double entry) {
        return machine.open(PositionSide.LONG, entry, BigDecimal.ONE, BigDecimal.TEN, bar(0), bar(0), null);
    }

    private OpenPosition basketLong(Instant lastLegBarAt) {
        Basket basket = Basket.open(
                new BigDecimal("1000"),
                new BigDecimal("0.02"),
                new BigDecimal("0.03"),
                new BasketLeg(100.0, new BigDecimal("0.15"))
        );
        return machine.open(PositionSide.LONG, 100.0, new BigDecimal("0.15"), BigDecimal.ONE, bar(0), lastLegBarAt, basket);
    }

    private PositionContext context(OhlcvCandle bar, double currentPrice, TrendDirection trend) {
        return new PositionContext(bar, currentPrice, WIDE_BAND, WIDE_BAND, trend, null, null, 1);
    }

    private PositionContext basketContext(BigDecimal equity, IndicatorPoint previous, IndicatorPoint latest, int maxLegs) {
        return new PositionContext(candle(101.0, 99.0), 100.0, previous, latest, TrendDirection.UP, null, equity, maxLegs);
    }

    private OhlcvCandle candle(double high, double low) {
        return new OhlcvCandle(bar(4), 100.0, high, low, (high + low) / 2.0, 1.0, false);
    }

    private IndicatorFrame frameUpTo(int lastIndex) {
        IndicatorPoint[] points = new IndicatorPoint[lastIndex + 1];
        for (int i = 0; i <= lastIndex; i++) {
            points[i] = point(i, 100.0, 100.0, 100.0, 90.0, 110.0);
        }
        return IndicatorFrames.of(points);
    }
}
