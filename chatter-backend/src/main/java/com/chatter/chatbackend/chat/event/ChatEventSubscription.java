package com.chatter.chatbackend.chat.event;

import java.time.Duration;

/**
 * One receiver on the {@link ChatEventHub}, owned by a single streaming session. Not shared
 * between threads apart from {@link #close()}.
 */
public class ChatEventSubscription implements AutoCloseable {

    private final ChatEventHub hub;
    private final long uid;

    // guarded by the hub lock
    long cursor;
    private volatile boolean closed;

    ChatEventSubscription(ChatEventHub hub, long uid, long cursor) {
        this.hub = hub;
        this.uid = uid;
        this.cursor = cursor;
    }

    public long uid() {
        return uid;
    }

    /**
     * Waits up to {@code timeout} for the next signal.
     *
     * @return the signal, or {@code null} if nothing arrived in time
     */
    public HubSignal poll(Duration timeout) throws InterruptedException {
        return hub.poll(this, timeout);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) return;
            closed = true;
        }
        hub.release(this);
    }
}
