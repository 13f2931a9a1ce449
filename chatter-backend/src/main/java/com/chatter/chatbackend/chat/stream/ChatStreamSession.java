package com.chatter.chatbackend.chat.stream;

import com.chatter.chatbackend.chat.dto.HeartbeatFrame;
import com.chatter.chatbackend.chat.dto.LaggedFrame;
import com.chatter.chatbackend.chat.event.ChatEvent;
import com.chatter.chatbackend.chat.event.ChatEventSubscription;
import com.chatter.chatbackend.chat.event.HubSignal;
import com.chatter.chatbackend.util.TimeFormat;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

/**
 * Pumps hub events and heartbeats into one client connection. Runs on its own thread until the
 * hub closes, the client goes away, or {@link #cancel()} is called; the subscription dies with it.
 */
@Slf4j
public class ChatStreamSession implements Runnable {

    public static final String EVENT_MESSAGE = "ChatMessage";
    public static final String EVENT_HEARTBEAT = "Heartbeat";
    public static final String EVENT_LAGGED = "Lagged";

    private final long uid;
    private final ChatEventSubscription subscription;
    private final StreamSink sink;
    private final Duration heartbeatInitialDelay;
    private final Duration heartbeatInterval;
    private final Clock clock;

    private volatile boolean cancelled;

    public ChatStreamSession(ChatEventSubscription subscription,
                             StreamSink sink,
                             Duration heartbeatInitialDelay,
                             Duration heartbeatInterval,
                             Clock clock) {
        this.uid = subscription.uid();
        this.subscription = subscription;
        this.sink = sink;
        this.heartbeatInitialDelay = heartbeatInitialDelay;
        this.heartbeatInterval = heartbeatInterval;
        this.clock = clock;
    }

    @Override
    public void run() {
        log.info("Chat stream opened for user {}", uid);
        long nextHeartbeat = System.nanoTime() + heartbeatInitialDelay.toNanos();
        try {
            while (!cancelled) {
                long wait = nextHeartbeat - System.nanoTime();
                if (wait <= 0) {
                    sink.send(EVENT_HEARTBEAT, new HeartbeatFrame(TimeFormat.format(TimeFormat.now(clock))));
                    nextHeartbeat = System.nanoTime() + heartbeatInterval.toNanos();
                    continue;
                }

                HubSignal signal = subscription.poll(Duration.ofNanos(wait));
                if (signal == null) continue;

                if (signal instanceof HubSignal.Delivered delivered) {
                    ChatEvent event = delivered.event();
                    if (event.isAddressedTo(uid)) {
                        sink.send(EVENT_MESSAGE, event.message());
                    }
                } else if (signal instanceof HubSignal.Lagged lagged) {
                    log.warn("Chat stream for user {} lagged, {} events missed", uid, lagged.missed());
                    sink.send(EVENT_LAGGED, new LaggedFrame(lagged.missed()));
                } else {
                    break;
                }
            }
        } catch (IOException e) {
            log.debug("Chat stream for user {} lost its client: {}", uid, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.warn("Chat stream for user {} failed", uid, e);
        } finally {
            subscription.close();
            sink.complete();
            log.info("Chat stream closed for user {}", uid);
        }
    }

    /** Ends the loop from another thread, e.g. when the container reports the connection gone. */
    public void cancel() {
        cancelled = true;
        subscription.close();
    }

    public long uid() {
        return uid;
    }
}
