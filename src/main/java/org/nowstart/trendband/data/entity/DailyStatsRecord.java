package org.nowstart.trendband.data.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "daily_stats")
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DailyStatsRecord extends AuditableEntity {

    @Id
    private LocalDate tradeDate;

    private int tradesToday;

    private int lossStreak;

    private boolean halted;

    private int wins;

    private int losses;

    @Column(precision = 38, scale = 12)
    private BigDecimal realizedPnl;

    private boolean reportSent;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "daily_trades", joinColumns = @JoinColumn(name = "trade_date"))
    @OrderColumn(name = "trade_index")
    private List<TradeJournalEntry> trades = new ArrayList<>();
}
