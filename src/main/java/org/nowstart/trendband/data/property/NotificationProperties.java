package org.nowstart.trendband.data.property;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "trendband.notification")
public record NotificationProperties(
        // Telegram bot API base URL
        @NotBlank @DefaultValue("https://api.telegram.org") String baseUrl,
        // bot token; blank disables sending
        @DefaultValue("") String token,
        // destination chat id
        @DefaultValue("") String chatId
) {

    public boolean enabled() {
        return !token.isBlank() && !chatId.isBlank();
    }
}
