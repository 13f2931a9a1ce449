package com.chatter.chatbackend.auth;

import com.chatter.chatbackend.util.TimeFormat;
import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDateTime;

public record LoginResponse(
        String accessToken,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = TimeFormat.PATTERN)
        LocalDateTime accessTokenExpires
) {
}
