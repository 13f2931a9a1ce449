package com.chatter.chatbackend.chat.event;

/** What a subscriber gets back from {@link ChatEventSubscription#poll}. */
public interface HubSignal {

    HubSignal CLOSED = new Closed();

    record Delivered(ChatEvent event) implements HubSignal {
    }

    /** The subscriber fell behind the ring and {@code missed} events are gone for it. */
    record Lagged(long missed) implements HubSignal {
    }

    record Closed() implements HubSignal {
    }
}
