package org.nowstart.trendband.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.nowstart.trendband.data.type.ExitReason;
import org.nowstart.trendband.data.type.PositionSide;

@Embeddable
@Getter
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TradeJournalEntry {

    private Instant closedAt;

    @Enumerated(EnumType.STRING)
    private PositionSide side;

    private double entryPrice;

    private double exitPrice;

    @Column(precision = 38, scale = 12)
    private BigDecimal quantity;

    @Column(precision = 38, scale = 12)
    private BigDecimal pnl;

    @Enumerated(EnumType.STRING)
    private ExitReason reason;
}
