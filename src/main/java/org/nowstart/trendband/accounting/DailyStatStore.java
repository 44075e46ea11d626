package org.nowstart.trendband.accounting;

import java.time.LocalDate;
import java.util.Optional;

public interface DailyStatStore {

    Optional<DailyStats> load(LocalDate date);

    void save(DailyStats stats);
}
