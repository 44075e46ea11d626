package org.nowstart.trendband.strategy.extension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.nowstart.trendband.indicator.IndicatorFrames.point;

import org.junit.jupiter.api.Test;
import org.nowstart.trendband.data.type.SignalDirection;
import org.nowstart.trendband.data.type.StrategyVariant;
import org.nowstart.trendband.indicator.IndicatorFrame;
import org.nowstart.trendband.indicator.IndicatorFrames;
import org.nowstart.trendband.strategy.core.StrategyEvaluation;
import org.nowstart.trendband.strategy.core.StrategyInput;
import org.nowstart.trendband.support.TestProperties;

class ExtensionReversionStrategyTest {

    private final ExtensionReversionStrategy strategy =
            new ExtensionReversionStrategy(TestProperties.strategy(StrategyVariant.EXTENSION_REVERSION));

    @Test
    void evaluate_reclaimAfterDownsideExtensionIsLong() {
        StrategyEvaluation evaluation = strategy.evaluate(new StrategyInput(frame(95.0, 101.0), 101.0));

        assertThat(evaluation.signal().direction()).isEqualTo(SignalDirection.LONG);
        assertThat(evaluation.signal().reason()).isEqualTo("REVERSION_UP");
    }

    @Test
    void evaluate_rejectionAfterUpsideExtensionIsShort() {
        StrategyEvaluation evaluation = strategy.evaluate(new StrategyInput(frame(105.0, 99.0), 99.0));

        assertThat(evaluation.signal().direction()).isEqualTo(SignalDirection.SHORT);
        assertThat(evaluation.signal().reason()).isEqualTo("REVERSION_DOWN");
    }

    @Test
    void evaluate_shallowMoveIsNotAnExtension() {
        StrategyEvaluation evaluation = strategy.evaluate(new StrategyInput(frame(99.0, 101.0), 101.0));

        assertThat(evaluation.signal().isActionable()).isFalse();
        assertThat(evaluation.signal().reason()).isEqualTo("NO_REVERSION");
    }

    private IndicatorFrame frame(double previousClose, double latestClose) {
        return IndicatorFrames.of(
                point(0, previousClose, 100.0, 100.0, 90.0, 110.0),
                point(1, latestClose, 100.0, 100.0, 90.0, 110.0)
        );
    }
}
