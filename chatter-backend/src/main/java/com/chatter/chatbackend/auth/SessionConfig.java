package com.chatter.chatbackend.auth;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class SessionConfig {

    // sessions idle out together with the tokens they back
    @Bean
    public SessionExpiryPolicy sessionExpiryPolicy(
            @Value("${security.jwt.access-token.expiration-ms:300000}") long accessTokenExpirationMs
    ) {
        return new IdleTimeoutPolicy(Duration.ofMillis(accessTokenExpirationMs));
    }

    @Bean
    public SessionRegistry sessionRegistry(SessionExpiryPolicy sessionExpiryPolicy, Clock clock) {
        return new SessionRegistry(sessionExpiryPolicy, clock);
    }
}
