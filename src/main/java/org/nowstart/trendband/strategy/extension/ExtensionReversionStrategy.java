package org.nowstart.trendband.strategy.extension;

import lombok.RequiredArgsConstructor;
import org.nowstart.trendband.data.property.StrategyProperties;
import org.nowstart.trendband.data.type.SignalDirection;
import org.nowstart.trendband.data.type.StrategyVariant;
import org.nowstart.trendband.data.type.TrendDirection;
import org.nowstart.trendband.indicator.IndicatorPoint;
import org.nowstart.trendband.strategy.core.RegimeCheck;
import org.nowstart.trendband.strategy.core.RegimeFilter;
import org.nowstart.trendband.strategy.core.Signal;
import org.nowstart.trendband.strategy.core.SignalStrategy;
import org.nowstart.trendband.strategy.core.StrategyEvaluation;
import org.nowstart.trendband.strategy.core.StrategyInput;
import org.nowstart.trendband.strategy.core.TrendClassifier;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ExtensionReversionStrategy implements SignalStrategy {

    private final StrategyProperties strategyProperties;

    @Override
    public StrategyVariant variant() {
        return StrategyVariant.EXTENSION_REVERSION;
    }

    @Override
    public StrategyEvaluation evaluate(StrategyInput input) {
        IndicatorPoint previous = input.frame().previous();
        IndicatorPoint current = input.frame().latest();
        TrendDirection trend = TrendClassifier.classify(
                current.emaFast(),
                current.emaSlow(),
                strategyProperties.trendMargin().doubleValue()
        );

        RegimeCheck regime = null;
        if (strategyProperties.regimeFilterEnabled()) {
            regime = RegimeFilter.from(strategyProperties).check(previous, current, input.currentPrice());
            if (!regime.admitted()) {
                return new StrategyEvaluation(Signal.none(variant(), "REGIME_BLOCKED"), trend, regime);
            }
        }

        double factor = strategyProperties.extensionFactor().doubleValue();
        double stretch = factor * previous.atr();
        boolean extendedBelow = previous.close() < previous.emaFast() - stretch;
        boolean extendedAbove = previous.close() > previous.emaFast() + stretch;
        boolean reclaimedAbove = current.close() > current.emaFast();
        boolean reclaimedBelow = current.close() < current.emaFast();

        if (extendedBelow && reclaimedAbove) {
            return new StrategyEvaluation(Signal.of(SignalDirection.LONG, variant(), "REVERSION_UP"), trend, regime);
        }
        if (extendedAbove && reclaimedBelow) {
            return new StrategyEvaluation(Signal.of(SignalDirection.SHORT, variant(), "REVERSION_DOWN"), trend, regime);
        }
        return new StrategyEvaluation(Signal.none(variant(), "NO_REVERSION"), trend, regime);
    }
}
