package com.chatter.chatbackend.chat.event;

import com.chatter.chatbackend.chat.ChatMessage;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A freshly stored message on its way to live sessions. Recipients are resolved at send time:
 * both DM participants, or every member of the group.
 */
public record ChatEvent(SortedSet<Long> recipients, ChatMessage message) {

    public ChatEvent {
        recipients = Collections.unmodifiableSortedSet(new TreeSet<>(recipients));
    }

    public static ChatEvent of(Collection<Long> recipients, ChatMessage message) {
        return new ChatEvent(new TreeSet<>(recipients), message);
    }

    public boolean isAddressedTo(long uid) {
        return recipients.contains(uid) || message.payload().fromUid() == uid;
    }
}
