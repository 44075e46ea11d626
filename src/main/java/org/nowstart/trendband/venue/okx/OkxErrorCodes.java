package org.nowstart.trendband.venue.okx;

import java.util.Set;
import org.nowstart.trendband.data.type.VenueErrorType;

final class OkxErrorCodes {

    // rate limit, system busy, service unavailable, endpoint timeout
    private static final Set<String> TRANSIENT = Set.of("50001", "50004", "50011", "50013", "50026");
    private static final Set<String> INSUFFICIENT_MARGIN = Set.of("51008", "51127", "51131");
    private static final Set<String> BELOW_MINIMUM = Set.of("51020", "51121");

    private OkxErrorCodes() {
    }

    static VenueErrorType classify(String code) {
        if (code == null || code.isBlank()) {
            return VenueErrorType.REJECTED;
        }
        if (TRANSIENT.contains(code)) {
            return VenueErrorType.TRANSIENT;
        }
        if (INSUFFICIENT_MARGIN.contains(code)) {
            return VenueErrorType.INSUFFICIENT_MARGIN;
        }
        if (BELOW_MINIMUM.contains(code)) {
            return VenueErrorType.BELOW_MINIMUM;
        }
        return VenueErrorType.REJECTED;
    }
}
