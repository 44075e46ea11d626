package org.nowstart.trendband.data.type;

import java.util.Locale;

public enum MarginMode {
    ISOLATED,
    CROSS;

    public String venueValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
