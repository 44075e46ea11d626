package org.nowstart.trendband.support;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.nowstart.trendband.accounting.DailyStatStore;
import org.nowstart.trendband.accounting.DailyStats;

public class InMemoryDailyStatStore implements DailyStatStore {

    private final Map<LocalDate, DailyStats> stats = new HashMap<>();

    @Override
    public Optional<DailyStats> load(LocalDate date) {
        return Optional.ofNullable(stats.get(date));
    }

    @Override
    public void save(DailyStats value) {
        stats.put(value.date(), value);
    }
}
