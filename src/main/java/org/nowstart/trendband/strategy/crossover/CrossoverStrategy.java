package org.nowstart.trendband.strategy.crossover;

import lombok.RequiredArgsConstructor;
import org.nowstart.trendband.data.property.StrategyProperties;
import org.nowstart.trendband.data.type.SignalDirection;
import org.nowstart.trendband.data.type.StrategyVariant;
import org.nowstart.trendband.data.type.TrendDirection;
import org.nowstart.trendband.indicator.IndicatorPoint;
import org.nowstart.trendband.strategy.core.CrossoverDetector;
import org.nowstart.trendband.strategy.core.Signal;
import org.nowstart.trendband.strategy.core.SignalStrategy;
import org.nowstart.trendband.strategy.core.StrategyEvaluation;
import org.nowstart.trendband.strategy.core.StrategyInput;
import org.nowstart.trendband.strategy.core.TrendClassifier;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CrossoverStrategy implements SignalStrategy {

    private final StrategyProperties strategyProperties;

    @Override
    public StrategyVariant variant() {
        return StrategyVariant.CROSSOVER;
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

        SignalDirection cross = CrossoverDetector.detect(
                previous.emaFast(),
                previous.emaSlow(),
                current.emaFast(),
                current.emaSlow(),
                strategyProperties.crossThreshold().doubleValue()
        );
        if (!cross.isActionable()) {
            return new StrategyEvaluation(Signal.none(variant(), "NO_CROSS"), trend, null);
        }

        if (strategyProperties.crossTrendFilter() && !agreesWithTrendEma(cross, input.currentPrice(), current.emaTrend())) {
            return new StrategyEvaluation(Signal.none(variant(), "CROSS_AGAINST_TREND_EMA"), trend, null);
        }

        String reason = cross == SignalDirection.LONG ? "CROSS_UP" : "CROSS_DOWN";
        return new StrategyEvaluation(Signal.of(cross, variant(), reason), trend, null);
    }

    private boolean agreesWithTrendEma(SignalDirection direction, double price, double emaTrend) {
        return direction == SignalDirection.LONG ? price > emaTrend : price < emaTrend;
    }
}
