package org.nowstart.trendband.accounting;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public record DailyStats(
        LocalDate date,
        int tradesToday,
        int lossStreak,
        boolean halted,
        int wins,
        int losses,
        BigDecimal realizedPnl,
        boolean reportSent,
        List<ClosedTrade> trades
) {

    public DailyStats {
        realizedPnl = realizedPnl == null ? BigDecimal.ZERO : realizedPnl;
        trades = trades == null ? List.of() : List.copyOf(trades);
    }

    public static DailyStats fresh(LocalDate date) {
        return new DailyStats(date, 0, 0, false, 0, 0, BigDecimal.ZERO, false, List.of());
    }

    public DailyStats withEntry() {
        return new DailyStats(date, tradesToday + 1, lossStreak, halted, wins, losses, realizedPnl, reportSent, trades);
    }

    /**
     * A win resets the loss streak; a loss extends it and halts the day once it reaches {@code lossStreakLimit}.
     */
    public DailyStats withExit(ClosedTrade trade, int lossStreakLimit) {
        List<ClosedTrade> journal = new ArrayList<>(trades);
        journal.add(trade);

        boolean win = trade.isWin();
        int streak = win ? 0 : lossStreak + 1;
        return new DailyStats(
                date,
                tradesToday,
                streak,
                halted || streak >= lossStreakLimit,
                win ? wins + 1 : wins,
                win ? losses : losses + 1,
                realizedPnl.add(trade.pnl()),
                reportSent,
                journal
        );
    }

    public DailyStats withReportSent() {
        return new DailyStats(date, tradesToday, lossStreak, halted, wins, losses, realizedPnl, true, trades);
    }

    public List<ClosedTrade> lastTrades(int count) {
        return trades.subList(Math.max(0, trades.size() - count), trades.size());
    }
}
