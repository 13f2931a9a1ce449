package com.chatter.chatbackend.auth;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class SessionSweepTask {

    private final SessionRegistry sessionRegistry;

    @Scheduled(fixedDelayString = "${security.session.sweep-interval-ms:60000}")
    public void evictExpiredSessions() {
        int evicted = sessionRegistry.evictExpired();
        if (evicted > 0) {
            log.info("Evicted {} idle login sessions, {} still active", evicted, sessionRegistry.size());
        }
    }
}
