package org.nowstart.trendband.accounting;

import java.time.LocalDate;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.nowstart.trendband.data.entity.DailyStatsRecord;
import org.nowstart.trendband.data.entity.TradeJournalEntry;
import org.nowstart.trendband.repository.DailyStatsRecordRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class JpaDailyStatStore implements DailyStatStore {

    private final DailyStatsRecordRepository dailyStatsRecordRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<DailyStats> load(LocalDate date) {
        return dailyStatsRecordRepository.findById(date).map(this::toStats);
    }

    @Override
    @Transactional
    public void save(DailyStats stats) {
        DailyStatsRecord record = dailyStatsRecordRepository.findById(stats.date())
                .orElseGet(() -> DailyStatsRecord.builder().tradeDate(stats.date()).build());
        record.setTradesToday(stats.tradesToday());
        record.setLossStreak(stats.lossStreak());
        record.setHalted(stats.halted());
        record.setWins(stats.wins());
        record.setLosses(stats.losses());
        record.setRealizedPnl(stats.realizedPnl());
        record.setReportSent(stats.reportSent());
        record.getTrades().clear();
        stats.trades().forEach(trade -> record.getTrades().add(toEntry(trade)));
        dailyStatsRecordRepository.save(record);
    }

    private DailyStats toStats(DailyStatsRecord record) {
        return new DailyStats(
                record.getTradeDate(),
                record.getTradesToday(),
                record.getLossStreak(),
                record.isHalted(),
                record.getWins(),
                record.getLosses(),
                record.getRealizedPnl(),
                record.isReportSent(),
                record.getTrades().stream().map(this::toTrade).toList()
        );
    }

    private TradeJournalEntry toEntry(ClosedTrade trade) {
        return new TradeJournalEntry(
                trade.closedAt(),
                trade.side(),
                trade.entryPrice(),
                trade.exitPrice(),
                trade.quantity(),
                trade.pnl(),
                trade.reason()
        );
    }

    private ClosedTrade toTrade(TradeJournalEntry entry) {
        return new ClosedTrade(
                entry.getClosedAt(),
                entry.getSide(),
                entry.getEntryPrice(),
                entry.getExitPrice(),
                entry.getQuantity(),
                entry.getPnl(),
                entry.getReason()
        );
    }
}
