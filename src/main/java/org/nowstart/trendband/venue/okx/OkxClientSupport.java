package org.nowstart.trendband.venue.okx;

import feign.RetryableException;
import java.math.BigDecimal;
import java.util.List;
import java.util.function.Supplier;
import org.nowstart.trendband.data.dto.OkxResponse;
import org.nowstart.trendband.data.exception.VenueException;

final class OkxClientSupport {

    private OkxClientSupport() {
    }

    static <T> OkxResponse<T> invoke(String operation, Supplier<OkxResponse<T>> call) {
        try {
            return call.get();
        } catch (RetryableException e) {
            throw VenueException.transientFailure("io", "OKX " + operation + " I/O failure: " + e.getMessage(), e);
        }
    }

    static <T> List<T> requireOk(String operation, OkxResponse<T> response) {
        if (response == null) {
            throw VenueException.transientFailure("empty", "OKX " + operation + " returned no body", null);
        }
        if (!response.isOk()) {
            throw new VenueException(
                    OkxErrorCodes.classify(response.code()),
                    response.code(),
                    "OKX " + operation + " failed code=" + response.code() + " msg=" + response.msg()
            );
        }
        return response.dataOrEmpty();
    }

    static BigDecimal decimal(String value) {
        if (value == null || value.isBlank()) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(value);
    }

    static double price(String value) {
        if (value == null || value.isBlank()) {
            return Double.NaN;
        }
        return Double.parseDouble(value);
    }
}
