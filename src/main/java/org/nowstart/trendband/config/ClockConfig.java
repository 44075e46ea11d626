package org.nowstart.trendband.config;

import java.time.Clock;
import org.nowstart.trendband.data.property.DailyProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(DailyProperties dailyProperties) {
        return Clock.system(dailyProperties.zoneId());
    }
}
