package org.nowstart.trendband.repository;

import java.time.LocalDate;
import org.nowstart.trendband.data.entity.DailyStatsRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DailyStatsRecordRepository extends JpaRepository<DailyStatsRecord, LocalDate> {
}
