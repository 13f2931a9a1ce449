package com.chatter.chatbackend.readindex;

import com.fasterxml.jackson.annotation.JsonValue;

/** Unread marker shown per conversation: {@code "all"} before any ack, otherwise the count. */
public final class Unread {

    public static final Unread ALL = new Unread("all");

    private final String value;

    private Unread(String value) {
        this.value = value;
    }

    public static Unread of(long count) {
        if (count <= 0) {
            throw new IllegalArgumentException("Unread count must be positive: " + count);
        }
        return new Unread(Long.toString(count));
    }

    @JsonValue
    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Unread other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
