package org.nowstart.trendband.venue.telegram;

import feign.FeignException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.trendband.data.dto.TelegramSendMessageRequest;
import org.nowstart.trendband.data.property.NotificationProperties;
import org.nowstart.trendband.repository.TelegramFeignClient;
import org.nowstart.trendband.venue.NotificationSink;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class TelegramNotificationSink implements NotificationSink {

    private final TelegramFeignClient telegramFeignClient;
    private final NotificationProperties notificationProperties;

    @Override
    public void send(String message) {
        if (!notificationProperties.enabled()) {
            log.debug("event=notification_skipped reason=disabled");
            return;
        }
        try {
            telegramFeignClient.sendMessage(
                    notificationProperties.token(),
                    new TelegramSendMessageRequest(notificationProperties.chatId(), message)
            );
        } catch (FeignException e) {
            log.warn("event=notification_failed status={} message={}", e.status(), e.getMessage());
        }
    }
}
