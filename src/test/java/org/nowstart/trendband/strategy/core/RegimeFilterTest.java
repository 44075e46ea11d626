package org.nowstart.trendband.strategy.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.nowstart.trendband.indicator.IndicatorPoint;

class RegimeFilterTest {

    private final RegimeFilter filter = new RegimeFilter(0.01, 0.0005, 0.02, 0.001);

    @Test
    void check_admitsQuietSidewaysMarket() {
        RegimeCheck check = filter.check(point(100.0, 1.0), point(100.05, 1.0), 100.0);

        assertThat(check.admitted()).isTrue();
        assertThat(check.atrRatio()).isEqualTo(0.01);
    }

    @Test
    void check_blocksSteepTrendSlope() {
        RegimeCheck check = filter.check(point(100.0, 1.0), point(100.5, 1.0), 100.0);

        assertThat(check.admitted()).isFalse();
    }

    @Test
    void check_blocksVolatilityOutsideBounds() {
        assertThat(filter.check(point(100.0, 0.01), point(100.0, 0.01), 100.0).admitted()).isFalse();
        assertThat(filter.check(point(100.0, 5.0), point(100.0, 5.0), 100.0).admitted()).isFalse();
    }

    @Test
    void check_blocksNonPositivePrice() {
        assertThat(filter.check(point(100.0, 1.0), point(100.0, 1.0), 0.0).admitted()).isFalse();
    }

    private IndicatorPoint point(double emaTrend, double atr) {
        return new IndicatorPoint(Instant.EPOCH, 101, 99, 100, 100.2, 100.0, emaTrend, atr, 105, 95, 100);
    }
}
