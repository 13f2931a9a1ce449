package com.chatter.chatbackend.auth;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class SessionRegistryTest {

    /** Clock the test moves by hand. */
    static class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-09-01T00:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private final MutableClock clock = new MutableClock();
    private final SessionRegistry registry =
            new SessionRegistry(new IdleTimeoutPolicy(Duration.ofMinutes(5)), clock);

    @Test
    void touchKeepsSessionAlive() {
        registry.register(1, "alice");

        clock.advance(Duration.ofMinutes(4));
        assertTrue(registry.touch(1).isPresent());

        clock.advance(Duration.ofMinutes(4));
        assertTrue(registry.isActive(1));
        assertEquals(clock.instant(), registry.touch(1).orElseThrow().lastAccessAt());
    }

    @Test
    void idleSessionExpires() {
        registry.register(1, "alice");

        clock.advance(Duration.ofMinutes(5));

        assertFalse(registry.isActive(1));
        assertTrue(registry.touch(1).isEmpty());
        assertEquals(0, registry.size());
    }

    @Test
    void logoutInvalidatesImmediately() {
        registry.register(1, "alice");
        registry.invalidate(1);

        assertTrue(registry.touch(1).isEmpty());
    }

    @Test
    void sweepDropsOnlyExpiredSessions() {
        registry.register(1, "alice");
        clock.advance(Duration.ofMinutes(3));
        registry.register(2, "bob");
        clock.advance(Duration.ofMinutes(3));

        assertEquals(1, registry.evictExpired());
        assertFalse(registry.isActive(1));
        assertTrue(registry.isActive(2));
    }

    @Test
    void customPolicyIsHonoured() {
        SessionRegistry neverExpires = new SessionRegistry((session, now) -> false, clock);
        neverExpires.register(1, "alice");

        clock.advance(Duration.ofDays(30));

        assertTrue(neverExpires.touch(1).isPresent());
    }
}
