package com.chatter.chatbackend.auth;

import java.time.Instant;

/** Decides when a login session stops being valid. */
public interface SessionExpiryPolicy {

    boolean isExpired(LoginSession session, Instant now);
}
