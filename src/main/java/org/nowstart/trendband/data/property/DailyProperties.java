package org.nowstart.trendband.data.property;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.LocalTime;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "trendband.daily")
public record DailyProperties(
        // consecutive losing closes that halt entries for the rest of the day
        @Positive @DefaultValue("3") int lossStreakLimit,
        // entries allowed per day; 0 means unlimited
        @PositiveOrZero @DefaultValue("0") int maxTradesPerDay,
        // local time the daily report is sent
        @NotNull @DefaultValue("23:59") LocalTime reportTime,
        // zone that defines the trading day
        @NotBlank @DefaultValue("Asia/Bangkok") String zone
) {

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
