package org.nowstart.trendband.strategy.envelope;

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
public class EnvelopeTouchStrategy implements SignalStrategy {

    private final StrategyProperties strategyProperties;

    @Override
    public StrategyVariant variant() {
        return StrategyVariant.ENVELOPE_TOUCH;
    }

    @Override
    public StrategyEvaluation evaluate(StrategyInput input) {
        IndicatorPoint previous = input.frame().previous();
        IndicatorPoint current = input.frame().latest();
        double price = input.currentPrice();
        TrendDirection trend = TrendClassifier.classify(
                current.emaFast(),
                current.emaSlow(),
                strategyProperties.trendMargin().doubleValue()
        );

        RegimeCheck regime = null;
        if (strategyProperties.regimeFilterEnabled()) {
            regime = RegimeFilter.from(strategyProperties).check(previous, current, price);
            if (!regime.admitted()) {
                return new StrategyEvaluation(Signal.none(variant(), "REGIME_BLOCKED"), trend, regime);
            }
        }

        if (trend == TrendDirection.UP && price <= current.envelopeLower()) {
            return new StrategyEvaluation(Signal.of(SignalDirection.LONG, variant(), "LOWER_BAND_TOUCH"), trend, regime);
        }
        if (trend == TrendDirection.DOWN && price >= current.envelopeUpper()) {
            return new StrategyEvaluation(Signal.of(SignalDirection.SHORT, variant(), "UPPER_BAND_TOUCH"), trend, regime);
        }
        return new StrategyEvaluation(Signal.none(variant(), "NO_TOUCH"), trend, regime);
    }
}
