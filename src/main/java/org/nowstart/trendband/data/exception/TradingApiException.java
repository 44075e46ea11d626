package org.nowstart.trendband.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class TradingApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public TradingApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public static TradingApiException notFound(String code, String message) {
        return new TradingApiException(HttpStatus.NOT_FOUND, code, message);
    }
}
