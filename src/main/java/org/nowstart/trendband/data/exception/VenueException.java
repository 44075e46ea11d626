package org.nowstart.trendband.data.exception;

import lombok.Getter;
import org.nowstart.trendband.data.type.VenueErrorType;

@Getter
public class VenueException extends RuntimeException {

    private final VenueErrorType type;
    private final String code;

    public VenueException(VenueErrorType type, String code, String message) {
        super(message);
        this.type = type;
        this.code = code;
    }

    public VenueException(VenueErrorType type, String code, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.code = code;
    }

    public boolean isTransient() {
        return type == VenueErrorType.TRANSIENT;
    }

    public static VenueException transientFailure(String code, String message, Throwable cause) {
        return new VenueException(VenueErrorType.TRANSIENT, code, message, cause);
    }

    public static VenueException fatal(String code, String message) {
        return new VenueException(VenueErrorType.FATAL, code, message);
    }
}
