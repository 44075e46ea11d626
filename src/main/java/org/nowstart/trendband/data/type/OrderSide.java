package org.nowstart.trendband.data.type;

import java.util.Locale;

public enum OrderSide {
    BUY,
    SELL;

    public String venueValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
