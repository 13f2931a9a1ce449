package com.chatter.chatbackend.chat;

/** A stored message as clients see it: the store id plus the decoded payload. */
public record ChatMessage(long mid, ChatMessagePayload payload) {
}
