package org.nowstart.trendband.data.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TelegramSendMessageRequest(
        @JsonProperty("chat_id") String chatId,
        String text
) {
}
