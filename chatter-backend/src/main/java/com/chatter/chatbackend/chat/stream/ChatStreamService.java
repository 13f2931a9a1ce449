package com.chatter.chatbackend.chat.stream;

import com.chatter.chatbackend.chat.event.ChatEventHub;
import com.chatter.chatbackend.chat.event.ChatEventSubscription;
import com.chatter.chatbackend.config.ChatProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Clock;

@Service
@Slf4j
public class ChatStreamService {

    private final ChatEventHub hub;
    private final ChatProperties properties;
    private final TaskExecutor executor;
    private final Clock clock;

    public ChatStreamService(ChatEventHub hub,
                             ChatProperties properties,
                             @Qualifier("chatStreamExecutor") TaskExecutor executor,
                             Clock clock) {
        this.hub = hub;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    /** Subscribes the user to the hub and hands the connection to a dedicated stream task. */
    public SseEmitter open(long uid) {
        SseEmitter emitter = new SseEmitter(0L);
        ChatEventSubscription subscription = hub.subscribe(uid);
        ChatStreamSession session = new ChatStreamSession(
                subscription,
                new SseStreamSink(emitter),
                properties.getStream().getHeartbeatInitialDelay(),
                properties.getStream().getHeartbeatInterval(),
                clock);

        emitter.onCompletion(session::cancel);
        emitter.onTimeout(session::cancel);
        emitter.onError(e -> session.cancel());

        try {
            executor.execute(session);
        } catch (TaskRejectedException e) {
            subscription.close();
            log.warn("Refusing chat stream for user {}: all {} stream slots busy",
                    uid, properties.getStream().getMaxSessions());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Too many open streams");
        }
        return emitter;
    }
}
