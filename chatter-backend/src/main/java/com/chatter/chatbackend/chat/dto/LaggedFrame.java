package com.chatter.chatbackend.chat.dto;

/** Tells the client that live delivery skipped {@code missed} messages and it should resync. */
public record LaggedFrame(long missed) {
}
