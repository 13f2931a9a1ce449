package com.chatter.chatbackend.config;

import com.chatter.chatbackend.chat.event.ChatEventHub;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class ChatConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ChatEventHub chatEventHub(ChatProperties properties) {
        return new ChatEventHub(properties.getHub().getCapacity());
    }

    @Bean(name = "chatStreamExecutor")
    public ThreadPoolTaskExecutor chatStreamExecutor(ChatProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(0);
        executor.setMaxPoolSize(properties.getStream().getMaxSessions());
        // no queueing: a stream either gets a thread or is refused
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("chat-stream-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
