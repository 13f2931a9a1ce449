package com.chatter.chatbackend.chat.event;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide bounded broadcast ring.
 * <p>
 * Every published event gets the next sequence number and lands in slot {@code seq % capacity},
 * overwriting whatever was there. Each subscription keeps its own cursor; a cursor that falls more
 * than {@code capacity} behind the head is told how many events it lost and moved to the oldest
 * retained one. Publishers never wait for subscribers.
 */
@Slf4j
public class ChatEventHub {

    private final ChatEvent[] ring;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition published = lock.newCondition();

    private long head;          // sequence number of the next event to publish
    private int subscribers;
    private boolean closed;

    public ChatEventHub(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Hub capacity must be positive: " + capacity);
        }
        this.ring = new ChatEvent[capacity];
    }

    /**
     * @return false when nobody was listening and the event was dropped
     */
    public boolean publish(ChatEvent event) {
        lock.lock();
        try {
            if (closed || subscribers == 0) {
                log.debug("No live subscribers, dropping event for message {}", event.message().mid());
                return false;
            }
            ring[(int) (head % ring.length)] = event;
            head++;
            published.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** A receiver for everything published from now on. */
    public ChatEventSubscription subscribe(long uid) {
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Hub is closed");
            }
            subscribers++;
            return new ChatEventSubscription(this, uid, head);
        } finally {
            lock.unlock();
        }
    }

    public int subscriberCount() {
        lock.lock();
        try {
            return subscribers;
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            published.signalAll();
            log.info("Chat event hub closed with {} subscribers attached", subscribers);
        } finally {
            lock.unlock();
        }
    }

    HubSignal poll(ChatEventSubscription sub, Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (!closed && !sub.isClosed() && sub.cursor == head) {
                if (nanos <= 0) return null;
                nanos = published.awaitNanos(nanos);
            }
            if (closed || sub.isClosed()) return HubSignal.CLOSED;

            long oldest = head - ring.length;
            if (sub.cursor < oldest) {
                long missed = oldest - sub.cursor;
                sub.cursor = oldest;
                return new HubSignal.Lagged(missed);
            }
            ChatEvent event = ring[(int) (sub.cursor % ring.length)];
            sub.cursor++;
            return new HubSignal.Delivered(event);
        } finally {
            lock.unlock();
        }
    }

    void release(ChatEventSubscription sub) {
        lock.lock();
        try {
            subscribers--;
            published.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
