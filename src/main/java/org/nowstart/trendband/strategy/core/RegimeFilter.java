package org.nowstart.trendband.strategy.core;

import org.nowstart.trendband.data.property.StrategyProperties;
import org.nowstart.trendband.indicator.IndicatorPoint;

/**
 * Sideways-market gate for mean-reversion entries. All three bounds must hold on the same tick.
 */
public final class RegimeFilter {

    private final double gapCap;
    private final double atrMinPct;
    private final double atrMaxPct;
    private final double slopeCap;

    public RegimeFilter(double gapCap, double atrMinPct, double atrMaxPct, double slopeCap) {
        this.gapCap = gapCap;
        this.atrMinPct = atrMinPct;
        this.atrMaxPct = atrMaxPct;
        this.slopeCap = slopeCap;
    }

    public static RegimeFilter from(StrategyProperties properties) {
        return new RegimeFilter(
                properties.regimeGapCap().doubleValue(),
                properties.regimeAtrMinPct().doubleValue(),
                properties.regimeAtrMaxPct().doubleValue(),
                properties.regimeSlopeCap().doubleValue()
        );
    }

    public RegimeCheck check(IndicatorPoint previous, IndicatorPoint current, double price) {
        if (!Double.isFinite(price) || price <= 0.0) {
            return new RegimeCheck(false, Double.NaN, Double.NaN, Double.NaN);
        }

        double gapRatio = Math.abs(current.emaFast() - current.emaSlow()) / price;
        double atrRatio = current.atr() / price;
        double slopeRatio = Math.abs(current.emaTrend() - previous.emaTrend()) / price;

        boolean admitted = gapRatio <= gapCap
                && atrRatio >= atrMinPct
                && atrRatio <= atrMaxPct
                && slopeRatio <= slopeCap;
        return new RegimeCheck(admitted, gapRatio, atrRatio, slopeRatio);
    }
}
