package com.chatter.chatbackend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.chat")
public class ChatProperties {

    /** Upper bound for history and sync page sizes. */
    private int maxPageSize = 100;

    private int maxContentLength = 4000;

    private Hub hub = new Hub();

    private Stream stream = new Stream();

    @Data
    public static class Hub {
        private int capacity = 128;
    }

    @Data
    public static class Stream {
        private Duration heartbeatInitialDelay = Duration.ofSeconds(5);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        // one pool thread per open stream
        private int maxSessions = 256;
    }
}
