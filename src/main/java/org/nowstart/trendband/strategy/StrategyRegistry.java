package org.nowstart.trendband.strategy;

import jakarta.annotation.PostConstruct;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.trendband.data.property.StrategyProperties;
import org.nowstart.trendband.data.type.StrategyVariant;
import org.nowstart.trendband.strategy.core.SignalStrategy;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StrategyRegistry {

    private final List<SignalStrategy> strategies;
    private final StrategyProperties strategyProperties;
    private Map<StrategyVariant, SignalStrategy> strategiesByVariant = Map.of();

    @PostConstruct
    void init() {
        Map<StrategyVariant, SignalStrategy> byVariant = new EnumMap<>(StrategyVariant.class);
        for (SignalStrategy strategy : strategies) {
            SignalStrategy previous = byVariant.put(strategy.variant(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate strategy registered for variant=" + strategy.variant());
            }
        }
        strategiesByVariant = Map.copyOf(byVariant);
    }

    public SignalStrategy getRequired(StrategyVariant variant) {
        if (variant == null) {
            throw new IllegalArgumentException("strategy variant is required");
        }
        SignalStrategy strategy = strategiesByVariant.get(variant);
        if (strategy == null) {
            throw new IllegalStateException("No strategy registered for variant=" + variant);
        }
        return strategy;
    }

    public SignalStrategy active() {
        return getRequired(strategyProperties.variant());
    }
}
