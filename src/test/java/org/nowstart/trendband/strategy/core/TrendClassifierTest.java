package org.nowstart.trendband.strategy.core;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.nowstart.trendband.data.type.TrendDirection;

class TrendClassifierTest {

    @Test
    void classify_respectsMargin() {
        assertThat(TrendClassifier.classify(101.0, 100.0, 0.5)).isEqualTo(TrendDirection.UP);
        assertThat(TrendClassifier.classify(100.4, 100.0, 0.5)).isEqualTo(TrendDirection.NONE);
        assertThat(TrendClassifier.classify(99.0, 100.0, 0.5)).isEqualTo(TrendDirection.DOWN);
    }

    @Test
    void classify_equalEmasWithoutMarginIsNone() {
        assertThat(TrendClassifier.classify(100.0, 100.0, 0.0)).isEqualTo(TrendDirection.NONE);
    }

    @Test
    void classify_undefinedIsNone() {
        assertThat(TrendClassifier.classify(Double.NaN, 100.0, 0.0)).isEqualTo(TrendDirection.NONE);
    }
}
