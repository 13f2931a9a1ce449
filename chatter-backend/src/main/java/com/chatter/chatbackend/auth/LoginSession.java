package com.chatter.chatbackend.auth;

import java.time.Instant;

public record LoginSession(long uid, String username, Instant loginAt, Instant lastAccessAt) {

    LoginSession touchedAt(Instant now) {
        return new LoginSession(uid, username, loginAt, now);
    }
}
