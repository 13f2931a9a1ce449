package com.chatter.chatbackend.auth;

import java.time.Duration;
import java.time.Instant;

/** Expires a session once it has not been used for {@code idleTimeout}. */
public class IdleTimeoutPolicy implements SessionExpiryPolicy {

    private final Duration idleTimeout;

    public IdleTimeoutPolicy(Duration idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    @Override
    public boolean isExpired(LoginSession session, Instant now) {
        return !session.lastAccessAt().plus(idleTimeout).isAfter(now);
    }
}
