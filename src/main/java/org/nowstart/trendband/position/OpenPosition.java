package org.nowstart.trendband.position;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import org.nowstart.trendband.data.type.PositionSide;

@Builder(toBuilder = true)
public record OpenPosition(
        PositionSide side,
        double entryPrice,
        BigDecimal quantity,
        double stopPrice,
        int trailingStep,
        int legCount,
        BigDecimal marginCommitted,
        Instant openedAt,
        Instant lastLegBarAt,
        Basket basket
) {

    public boolean isBasket() {
        return basket != null;
    }

    public OpenPosition withTrailingStep(int step, double stop) {
        if (step < trailingStep) {
            throw new IllegalArgumentException("trailing step cannot move back from " + trailingStep + " to " + step);
        }
        return toBuilder().trailingStep(step).stopPrice(stop).build();
    }

    public double excursion(double price) {
        return side.sign() * (price - entryPrice);
    }
}
