package org.nowstart.trendband.accounting;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.trendband.data.property.DailyProperties;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class DailyAccounting {

    private final Clock clock;
    private final DailyProperties dailyProperties;
    private final DailyStatStore store;
    private volatile DailyStats current;

    public DailyAccounting(Clock clock, DailyProperties dailyProperties, DailyStatStore store) {
        this.clock = clock.withZone(dailyProperties.zoneId());
        this.dailyProperties = dailyProperties;
        this.store = store;
    }

    public Optional<DailyStats> rollIfNewDay() {
        LocalDate today = LocalDate.now(clock);
        if (current == null) {
            current = store.load(today).orElseGet(() -> DailyStats.fresh(today));
            return Optional.empty();
        }
        if (current.date().equals(today)) {
            return Optional.empty();
        }

        DailyStats previous = current;
        current = store.load(today).orElseGet(() -> DailyStats.fresh(today));
        log.info(
                "event=daily_rollover previousDate={} trades={} wins={} losses={} pnl={} halted={}",
                previous.date(),
                previous.tradesToday(),
                previous.wins(),
                previous.losses(),
                previous.realizedPnl(),
                previous.halted()
        );
        return Optional.of(previous);
    }

    public DailyStats today() {
        if (current == null) {
            rollIfNewDay();
        }
        return current;
    }

    public Optional<DailyStats> current() {
        return Optional.ofNullable(current);
    }

    public Optional<String> entryBlockReason() {
        DailyStats stats = today();
        if (stats.halted()) {
            return Optional.of("DAILY_HALT");
        }
        int maxTrades = dailyProperties.maxTradesPerDay();
        if (maxTrades > 0 && stats.tradesToday() >= maxTrades) {
            return Optional.of("MAX_TRADES_PER_DAY");
        }
        return Optional.empty();
    }

    public void recordEntry() {
        current = today().withEntry();
        persist(current);
    }

    public boolean recordExit(ClosedTrade trade) {
        DailyStats before = today();
        current = before.withExit(trade, dailyProperties.lossStreakLimit());
        persist(current);
        log.info(
                "event=daily_exit pnl={} win={} lossStreak={} halted={} realizedPnl={}",
                trade.pnl(),
                trade.isWin(),
                current.lossStreak(),
                current.halted(),
                current.realizedPnl()
        );
        return !before.halted() && current.halted();
    }

    public void markReportSent() {
        current = today().withReportSent();
        persist(current);
    }

    public void markReportSent(DailyStats previousDay) {
        persist(previousDay.withReportSent());
    }

    private void persist(DailyStats stats) {
        try {
            store.save(stats);
        } catch (DataAccessException e) {
            log.warn("event=daily_stats_save_failed date={} message={}", stats.date(), e.getMessage(), e);
        }
    }
}
