package org.nowstart.trendband.accounting;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.trendband.config.JpaAuditingConfig;
import org.nowstart.trendband.data.type.ExitReason;
import org.nowstart.trendband.data.type.PositionSide;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import({JpaDailyStatStore.class, JpaAuditingConfig.class})
class JpaDailyStatStoreDataTest {

    private static final LocalDate DAY = LocalDate.of(2024, 5, 1);

    @Autowired
    private JpaDailyStatStore store;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    void save_keepsFractionalQuantityAndPnlAcrossReload() {
        ClosedTrade trade = new ClosedTrade(
                Instant.parse("2024-05-01T05:00:00Z"),
                PositionSide.LONG,
                64000.5,
                63700.2,
                new BigDecimal("0.0037"),
                new BigDecimal("-1.1137"),
                ExitReason.STOP_LOSS
        );
        store.save(new DailyStats(DAY, 1, 1, false, 0, 1, new BigDecimal("-1.1137"), false, List.of(trade)));
        entityManager.flush();
        entityManager.clear();

        DailyStats loaded = store.load(DAY).orElseThrow();

        assertThat(loaded.realizedPnl()).isEqualByComparingTo("-1.1137");
        assertThat(loaded.trades()).singleElement().satisfies(entry -> {
            assertThat(entry.quantity()).isEqualByComparingTo("0.0037");
            assertThat(entry.pnl()).isEqualByComparingTo("-1.1137");
            assertThat(entry.exitPrice()).isEqualTo(63700.2);
        });
    }

    @Test
    void save_updatesExistingDayInPlace() {
        store.save(DailyStats.fresh(DAY).withEntry());
        entityManager.flush();
        entityManager.clear();

        store.save(store.load(DAY).orElseThrow().withEntry());
        entityManager.flush();
        entityManager.clear();

        assertThat(store.load(DAY)).hasValueSatisfying(stats -> assertThat(stats.tradesToday()).isEqualTo(2));
        assertThat(store.load(DAY.plusDays(1))).isEmpty();
    }
}
