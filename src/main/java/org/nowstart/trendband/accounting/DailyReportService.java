package org.nowstart.trendband.accounting;

import java.time.Clock;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.trendband.data.property.DailyProperties;
import org.nowstart.trendband.venue.NotificationSink;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class DailyReportService {

    static final int REPORT_TRADE_COUNT = 20;
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final DailyAccounting dailyAccounting;
    private final NotificationSink notificationSink;
    private final DailyProperties dailyProperties;
    private final Clock clock;

    public DailyReportService(
            DailyAccounting dailyAccounting,
            NotificationSink notificationSink,
            DailyProperties dailyProperties,
            Clock clock
    ) {
        this.dailyAccounting = dailyAccounting;
        this.notificationSink = notificationSink;
        this.dailyProperties = dailyProperties;
        this.clock = clock.withZone(dailyProperties.zoneId());
    }

    public void onRollover(DailyStats previousDay) {
        if (previousDay.reportSent()) {
            return;
        }
        notificationSink.send(format(previousDay));
        dailyAccounting.markReportSent(previousDay);
        log.info("event=daily_report date={} forced=true", previousDay.date());
    }

    public void sendIfDue() {
        DailyStats today = dailyAccounting.today();
        if (today.reportSent() || LocalTime.now(clock).isBefore(dailyProperties.reportTime())) {
            return;
        }
        notificationSink.send(format(today));
        dailyAccounting.markReportSent();
        log.info("event=daily_report date={} forced=false", today.date());
    }

    String format(DailyStats stats) {
        StringBuilder report = new StringBuilder()
                .append("Daily report ").append(stats.date()).append('\n')
                .append("PnL: ").append(stats.realizedPnl().toPlainString()).append('\n')
                .append("Wins: ").append(stats.wins())
                .append(" / Losses: ").append(stats.losses())
                .append(" / Entries: ").append(stats.tradesToday()).append('\n');
        if (stats.halted()) {
            report.append("Halted after ").append(stats.lossStreak()).append(" consecutive losses\n");
        }

        List<ClosedTrade> trades = stats.lastTrades(REPORT_TRADE_COUNT);
        if (trades.isEmpty()) {
            report.append("No closed trades");
            return report.toString();
        }
        for (ClosedTrade trade : trades) {
            report.append(TIME_FORMAT.format(trade.closedAt().atZone(dailyProperties.zoneId())))
                    .append(' ').append(trade.side())
                    .append(' ').append(trade.entryPrice())
                    .append(" -> ").append(trade.exitPrice())
                    .append(" qty=").append(trade.quantity().toPlainString())
                    .append(" pnl=").append(trade.pnl().toPlainString())
                    .append(' ').append(trade.reason())
                    .append('\n');
        }
        return report.toString().stripTrailing();
    }
}
