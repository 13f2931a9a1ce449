package com.chatter.chatbackend.chat;

import com.chatter.chatbackend.util.TimeFormat;
import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDateTime;

public record ChatMessagePayload(
        long fromUid,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = TimeFormat.PATTERN)
        LocalDateTime createdAt,
        MessageTarget target,
        MessageDetail detail
) {
}
