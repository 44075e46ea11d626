package org.nowstart.trendband.strategy.core;

public record RegimeCheck(
        boolean admitted,
        double gapRatio,
        double atrRatio,
        double slopeRatio
) {
}
