package com.chatter.chatbackend.auth;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Users that are currently logged in, one session per user id. A signed token is only honoured
 * while its user has a live session here, which is what makes logout effective.
 */
@Slf4j
public class SessionRegistry {

    private final Map<Long, LoginSession> sessions = new ConcurrentHashMap<>();
    private final SessionExpiryPolicy expiryPolicy;
    private final Clock clock;

    public SessionRegistry(SessionExpiryPolicy expiryPolicy, Clock clock) {
        this.expiryPolicy = expiryPolicy;
        this.clock = clock;
    }

    /** Starts (or restarts) the session of {@code uid}. */
    public LoginSession register(long uid, String username) {
        Instant now = clock.instant();
        LoginSession session = new LoginSession(uid, username, now, now);
        sessions.put(uid, session);
        log.debug("Session opened for user {}", uid);
        return session;
    }

    /**
     * Marks the session as used.
     *
     * @return the refreshed session, empty if there is none or it had already expired
     */
    public Optional<LoginSession> touch(long uid) {
        Instant now = clock.instant();
        LoginSession touched = sessions.computeIfPresent(uid,
                (id, s) -> expiryPolicy.isExpired(s, now) ? null : s.touchedAt(now));
        return Optional.ofNullable(touched);
    }

    public boolean isActive(long uid) {
        LoginSession s = sessions.get(uid);
        return s != null && !expiryPolicy.isExpired(s, clock.instant());
    }

    public void invalidate(long uid) {
        if (sessions.remove(uid) != null) {
            log.debug("Session closed for user {}", uid);
        }
    }

    /** @return how many sessions were dropped */
    public int evictExpired() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.values().removeIf(s -> expiryPolicy.isExpired(s, now));
        return before - sessions.size();
    }

    public int size() {
        return sessions.size();
    }
}
