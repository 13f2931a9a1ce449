package com.chatter.chatbackend.msg;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Append-only message log partitioned by conversation.
 * <p>
 * Ids are assigned by the store, strictly increasing across all partitions and never reused.
 * Range queries silently leave out entries that can no longer be read back intact.
 */
public interface MessageStore {

    /** Append to the DM partition of {@code from} and {@code to}; direction does not matter. */
    long sendToDm(long from, long to, byte[] payload);

    /**
     * Append once to the group partition. {@code memberIds} is the membership at send time and is
     * only used to feed {@link #fetchUserMessagesAfter}.
     */
    long sendToGroup(long groupId, Collection<Long> memberIds, byte[] payload);

    /** Up to {@code limit} entries with id &lt; {@code beforeId} (all when null), newest first. */
    List<StoredMessage> fetchDmMessagesBefore(long userA, long userB, Long beforeId, int limit);

    List<StoredMessage> fetchGroupMessagesBefore(long groupId, Long beforeId, int limit);

    /** Everything addressed to or from the user with id &gt; {@code afterId}, oldest first. */
    List<StoredMessage> fetchUserMessagesAfter(long userId, Long afterId, int limit);

    Optional<byte[]> get(long mid);

    long countDmMessagesAfter(long userA, long userB, long afterId);

    long countGroupMessagesAfter(long groupId, long afterId);

    /** Whether {@code mid} was stored in the DM partition of the two users. */
    boolean containsDmMessage(long userA, long userB, long mid);

    boolean containsGroupMessage(long groupId, long mid);

    /** Highest id handed out so far, 0 for an empty store. */
    long lastMessageId();
}
