package org.nowstart.trendband.position;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

public record Basket(
        BigDecimal equityAtOpen,
        BigDecimal targetFraction,
        BigDecimal stopFraction,
        List<BasketLeg> legs
) {

    public Basket {
        legs = legs == null ? List.of() : List.copyOf(legs);
    }

    public static Basket open(BigDecimal equityAtOpen, BigDecimal targetFraction, BigDecimal stopFraction, BasketLeg firstLeg) {
        return new Basket(equityAtOpen, targetFraction, stopFraction, List.of(firstLeg));
    }

    public BigDecimal targetEquity() {
        return equityAtOpen.add(equityAtOpen.multiply(targetFraction));
    }

    public BigDecimal stopEquity() {
        return equityAtOpen.subtract(equityAtOpen.multiply(stopFraction));
    }

    public Basket withLeg(BasketLeg leg) {
        List<BasketLeg> next = new ArrayList<>(legs);
        next.add(leg);
        return new Basket(equityAtOpen, targetFraction, stopFraction, next);
    }
}
