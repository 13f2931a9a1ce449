package com.chatter.chatbackend.msg;

/** A persisted log entry: store-assigned id plus the opaque payload bytes. */
public record StoredMessage(long mid, byte[] payload) {
}
