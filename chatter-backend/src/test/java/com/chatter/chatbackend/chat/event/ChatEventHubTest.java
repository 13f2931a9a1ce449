package com.chatter.chatbackend.chat.event;

import com.chatter.chatbackend.chat.ChatTestMessages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ChatEventHubTest {

    private static final Duration SHORT = Duration.ofMillis(50);

    private final ChatEventHub hub = new ChatEventHub(4);

    @AfterEach
    void tearDown() {
        hub.close();
    }

    private static ChatEvent event(long mid) {
        return ChatEvent.of(List.of(1L, 2L), ChatTestMessages.dm(mid, 1, 2, "m" + mid));
    }

    @Test
    void publishWithoutSubscribersIsDropped() throws Exception {
        assertFalse(hub.publish(event(1)));

        ChatEventSubscription sub = hub.subscribe(1);
        // nothing from before the subscription is replayed
        assertNull(sub.poll(SHORT));
    }

    @Test
    void everySubscriberSeesEventsInOrder() throws Exception {
        ChatEventSubscription a = hub.subscribe(1);
        ChatEventSubscription b = hub.subscribe(2);

        assertTrue(hub.publish(event(1)));
        assertTrue(hub.publish(event(2)));

        for (ChatEventSubscription sub : List.of(a, b)) {
            HubSignal first = sub.poll(SHORT);
            HubSignal second = sub.poll(SHORT);
            assertEquals(1, ((HubSignal.Delivered) first).event().message().mid());
            assertEquals(2, ((HubSignal.Delivered) second).event().message().mid());
            assertNull(sub.poll(SHORT));
        }
    }

    @Test
    void slowSubscriberIsToldHowManyEventsItMissed() throws Exception {
        ChatEventSubscription sub = hub.subscribe(1);
        for (long mid = 1; mid <= 6; mid++) {
            hub.publish(event(mid));
        }

        HubSignal signal = sub.poll(SHORT);
        assertEquals(new HubSignal.Lagged(2), signal);

        // continues from the oldest event still in the ring
        for (long mid = 3; mid <= 6; mid++) {
            HubSignal next = sub.poll(SHORT);
            assertInstanceOf(HubSignal.Delivered.class, next);
            assertEquals(mid, ((HubSignal.Delivered) next).event().message().mid());
        }
    }

    @Test
    void pollWakesUpOnPublish() throws Exception {
        ChatEventSubscription sub = hub.subscribe(1);
        CompletableFuture<HubSignal> waiting = CompletableFuture.supplyAsync(() -> {
            try {
                return sub.poll(Duration.ofSeconds(5));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(50);
        hub.publish(event(9));

        HubSignal signal = waiting.get(5, TimeUnit.SECONDS);
        assertEquals(9, ((HubSignal.Delivered) signal).event().message().mid());
    }

    @Test
    void closingTheHubReleasesSubscribers() throws Exception {
        ChatEventSubscription sub = hub.subscribe(1);

        hub.close();

        assertSame(HubSignal.CLOSED, sub.poll(Duration.ofSeconds(1)));
        assertThrows(IllegalStateException.class, () -> hub.subscribe(2));
    }

    @Test
    void subscriberCountFollowsSubscriptionLifetime() {
        ChatEventSubscription a = hub.subscribe(1);
        ChatEventSubscription b = hub.subscribe(2);
        assertEquals(2, hub.subscriberCount());

        a.close();
        a.close();
        assertEquals(1, hub.subscriberCount());

        b.close();
        assertEquals(0, hub.subscriberCount());
        assertFalse(hub.publish(event(1)));
    }

    @Test
    void eventIsAddressedToRecipientsAndSender() {
        ChatEvent groupEvent = ChatEvent.of(List.of(2L, 3L), ChatTestMessages.group(1, 1, 7, "hi"));

        assertTrue(groupEvent.isAddressedTo(2));
        assertTrue(groupEvent.isAddressedTo(3));
        assertTrue(groupEvent.isAddressedTo(1));
        assertFalse(groupEvent.isAddressedTo(4));
    }
}
