package org.nowstart.trendband.data.property;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "trendband.position")
public record PositionProperties(
        // initial stop distance from entry in price points (entry -/+ stopDistance)
        @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("300") BigDecimal stopDistance,
        // trailing steps in activation order; step n+1 applies once favorable excursion >= trigger
        @Valid List<TrailingStep> trailingSteps,
        // closed bars that must elapse after an exit before a new entry
        @PositiveOrZero @DefaultValue("0") int cooldownBars,
        // lock entries after a stop-loss until a closed bar settles inside the envelope
        @DefaultValue("true") boolean lockAfterStopLoss,
        // take profit at the opposite envelope band
        @DefaultValue("true") boolean envelopeTakeProfit,
        // close immediately when the trend turns against the position
        @DefaultValue("true") boolean closeOnTrendFlip,
        // venue position polls after a close request before giving up for this cycle
        @Positive @DefaultValue("10") int exitConfirmAttempts,
        // pause between exit confirmation polls
        @NotNull @DefaultValue("300ms") Duration exitConfirmInterval,
        // venue position polls after an entry order before treating it as unfilled
        @Positive @DefaultValue("3") int entryConfirmAttempts,
        // retries for transient venue failures within one cycle
        @PositiveOrZero @DefaultValue("2") int transientRetries,
        // fixed backoff between transient retries
        @NotNull @DefaultValue("500ms") Duration transientBackoff
) {

    public PositionProperties {
        trailingSteps = trailingSteps == null ? List.of() : List.copyOf(trailingSteps);
    }

    public record TrailingStep(
            @NotNull @DecimalMin("0") BigDecimal trigger,
            @NotNull BigDecimal stopOffset
    ) {
    }
}
