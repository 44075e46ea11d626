package org.nowstart.trendband.repository;

import org.nowstart.trendband.data.dto.TelegramSendMessageRequest;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

@FeignClient(
        name = "telegramClient",
        url = "${trendband.notification.base-url:https://api.telegram.org}"
)
public interface TelegramFeignClient {

    @PostMapping(value = "/bot{token}/sendMessage", consumes = "application/json")
    void sendMessage(@PathVariable("token") String token, @RequestBody TelegramSendMessageRequest request);
}
