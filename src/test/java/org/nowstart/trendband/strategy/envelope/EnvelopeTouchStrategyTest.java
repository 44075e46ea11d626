package org.nowstart.trendband.strategy.envelope;

import static org.assertj.core.api.Assertions.assertThat;
import static org.nowstart.trendband.indicator.IndicatorFrames.point;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import org.nowstart.trendband.data.type.SignalDirection;
import org.nowstart.trendband.data.type.StrategyVariant;
import org.nowstart.trendband.indicator.IndicatorFrame;
import org.nowstart.trendband.indicator.IndicatorFrames;
import org.nowstart.trendband.strategy.core.StrategyEvaluation;
import org.nowstart.trendband.strategy.core.StrategyInput;
import org.nowstart.trendband.support.TestProperties;

class EnvelopeTouchStrategyTest {

    @Test
    void evaluate_lowerBandTouchInUptrendIsLong() {
        StrategyEvaluation evaluation = strategy(false).evaluate(new StrategyInput(frame(100.5, 100.0), 95.5));

        assertThat(evaluation.signal().direction()).isEqualTo(SignalDirection.LONG);
        assertThat(evaluation.signal().reason()).isEqualTo("LOWER_BAND_TOUCH");
    }

    @Test
    void evaluate_upperBandTouchInDowntrendIsShort() {
        StrategyEvaluation evaluation = strategy(false).evaluate(new StrategyInput(frame(99.5, 100.0), 104.5));

        assertThat(evaluation.signal().direction()).isEqualTo(SignalDirection.SHORT);
        assertThat(evaluation.signal().reason()).isEqualTo("UPPER_BAND_TOUCH");
    }

    @Test
    void evaluate_upperBandTouchInUptrendIsIgnored() {
        StrategyEvaluation evaluation = strategy(false).evaluate(new StrategyInput(frame(100.5, 100.0), 104.5));

        assertThat(evaluation.signal().isActionable()).isFalse();
        assertThat(evaluation.signal().reason()).isEqualTo("NO_TOUCH");
    }

    @Test
    void evaluate_regimeFilterBlocksWideEmaGap() {
        StrategyEvaluation evaluation = strategy(true).evaluate(new StrategyInput(frame(110.0, 100.0), 95.5));

        assertThat(evaluation.signal().isActionable()).isFalse();
        assertThat(evaluation.signal().reason()).isEqualTo("REGIME_BLOCKED");
        assertThat(evaluation.regime().admitted()).isFalse();
    }

    @Test
    void evaluate_regimeFilterAdmitsSidewaysTouch() {
        StrategyEvaluation evaluation = strategy(true).evaluate(new StrategyInput(frame(100.5, 100.0), 95.5));

        assertThat(evaluation.signal().direction()).isEqualTo(SignalDirection.LONG);
        assertThat(evaluation.regime().admitted()).isTrue();
    }

    private IndicatorFrame frame(double emaFast, double emaSlow) {
        return IndicatorFrames.of(
                point(0, 100.0, emaFast, emaSlow, 96.0, 104.0),
                point(1, 100.0, emaFast, emaSlow, 96.0, 104.0)
        );
    }

    private EnvelopeTouchStrategy strategy(boolean regimeFilter) {
        return new EnvelopeTouchStrategy(
                TestProperties.strategy(StrategyVariant.ENVELOPE_TOUCH, BigDecimal.ZERO, false, regimeFilter)
        );
    }
}
