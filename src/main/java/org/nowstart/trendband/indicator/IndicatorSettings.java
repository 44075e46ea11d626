package org.nowstart.trendband.indicator;

import org.nowstart.trendband.data.property.StrategyProperties;

public record IndicatorSettings(
        int emaFast,
        int emaSlow,
        int emaTrend,
        int atrPeriod,
        double envelopeBandwidth,
        double envelopeMultiplier,
        int envelopeWindow
) {

    public IndicatorSettings {
        if (emaFast <= 0 || emaSlow <= 0 || emaTrend <= 0 || atrPeriod <= 0 || envelopeWindow <= 0) {
            throw new IllegalArgumentException("indicator periods must be positive");
        }
        if (!(envelopeBandwidth > 0.0) || !(envelopeMultiplier > 0.0)) {
            throw new IllegalArgumentException("envelope bandwidth and multiplier must be positive");
        }
    }

    public static IndicatorSettings from(StrategyProperties properties) {
        return new IndicatorSettings(
                properties.emaFast(),
                properties.emaSlow(),
                properties.emaTrend(),
                properties.atrPeriod(),
                properties.envelopeBandwidth().doubleValue(),
                properties.envelopeMultiplier().doubleValue(),
                properties.envelopeWindow()
        );
    }

    public int requiredBars() {
        int longestEma = Math.max(emaFast, Math.max(emaSlow, emaTrend));
        int longest = Math.max(longestEma, Math.max(atrPeriod, envelopeWindow + 1));
        return longest + 1;
    }
}
