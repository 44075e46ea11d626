package org.nowstart.trendband.venue;

import java.time.Duration;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.trendband.data.exception.VenueException;
import org.nowstart.trendband.data.property.PositionProperties;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class VenueCallExecutor {

    private final Sleeper sleeper;
    private final int retries;
    private final Duration backoff;

    public VenueCallExecutor(Sleeper sleeper, PositionProperties positionProperties) {
        this.sleeper = sleeper;
        this.retries = positionProperties.transientRetries();
        this.backoff = positionProperties.transientBackoff();
    }

    public <T> T call(String operation, Supplier<T> call) {
        int attempt = 0;
        while (true) {
            try {
                return call.get();
            } catch (VenueException e) {
                if (!e.isTransient() || attempt >= retries) {
                    throw e;
                }
                attempt++;
                log.warn("event=venue_retry operation={} attempt={} code={} message={}", operation, attempt, e.getCode(), e.getMessage());
                pause(backoff);
            }
        }
    }

    public void pause(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw VenueException.transientFailure("interrupted", "interrupted while waiting for venue", e);
        }
    }
}
