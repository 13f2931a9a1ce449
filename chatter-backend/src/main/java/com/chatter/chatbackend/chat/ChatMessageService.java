package com.chatter.chatbackend.chat;

import com.chatter.chatbackend.chat.event.ChatEvent;
import com.chatter.chatbackend.chat.event.ChatEventHub;
import com.chatter.chatbackend.config.ChatProperties;
import com.chatter.chatbackend.friend.FriendGraph;
import com.chatter.chatbackend.group.GroupService;
import com.chatter.chatbackend.msg.MessageStore;
import com.chatter.chatbackend.readindex.ReadIndexService;
import com.chatter.chatbackend.shared.ChatValidationException;
import com.chatter.chatbackend.util.TimeFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Send, history and sync on top of the message store.
 * <p>
 * A send goes store first, then read indexes, then the live hub. Once the store accepted the
 * message it is durable; a later failure only costs live delivery or unread bookkeeping.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatMessageService {

    private final MessageStore messageStore;
    private final ChatPayloadCodec codec;
    private final ChatEventHub hub;
    private final ReadIndexService readIndexService;
    private final GroupService groupService;
    private final FriendGraph friendGraph;
    private final ChatProperties properties;
    private final Clock clock;

    public ChatMessage send(long fromUid, MessageTarget target, MessageDetail detail) {
        validate(detail);

        SortedSet<Long> recipients = new TreeSet<>();
        if (target instanceof MessageTarget.ToUser toUser) {
            if (!friendGraph.isFriend(fromUid, toUser.uid())) {
                throw new ResponseStatusException(HttpStatus.FORBIDDEN, "You are not friends with this user");
            }
            recipients.add(fromUid);
            recipients.add(toUser.uid());
        } else if (target instanceof MessageTarget.ToGroup toGroup) {
            recipients.addAll(groupService.getSendableMemberIds(toGroup.gid(), fromUid));
        } else {
            throw new ChatValidationException("Unsupported message target");
        }
        validateReply(fromUid, target, detail.replyTo());

        ChatMessagePayload payload = new ChatMessagePayload(fromUid, TimeFormat.now(clock), target, detail);
        byte[] bytes = codec.encode(payload);

        long mid = target instanceof MessageTarget.ToUser toUser
                ? storeDm(fromUid, toUser.uid(), bytes)
                : storeGroup(fromUid, ((MessageTarget.ToGroup) target).gid(), recipients, bytes);

        ChatMessage message = new ChatMessage(mid, payload);
        hub.publish(ChatEvent.of(recipients, message));
        return message;
    }

    /** Newest-first page of the conversation, strictly older than {@code before} when given. */
    public List<ChatMessage> history(long uid, MessageTarget target, Long before, Integer limit) {
        int pageSize = clampLimit(limit);
        if (target instanceof MessageTarget.ToUser toUser) {
            return codec.decodeAll(messageStore.fetchDmMessagesBefore(uid, toUser.uid(), before, pageSize));
        }
        MessageTarget.ToGroup toGroup = (MessageTarget.ToGroup) target;
        groupService.requireMember(toGroup.gid(), uid);
        return codec.decodeAll(messageStore.fetchGroupMessagesBefore(toGroup.gid(), before, pageSize));
    }

    /** Everything to or from the user after {@code after}, oldest first. */
    public List<ChatMessage> sync(long uid, Long after, Integer limit) {
        return codec.decodeAll(messageStore.fetchUserMessagesAfter(uid, after, clampLimit(limit)));
    }

    /** Resolves ids in the given order, leaving out missing ones and those the user may not see. */
    public List<ChatMessage> getByMids(long uid, Collection<Long> mids) {
        List<ChatMessage> out = new ArrayList<>(mids.size());
        for (Long mid : mids) {
            if (mid == null) continue;
            findVisible(uid, mid).ifPresent(out::add);
        }
        return out;
    }

    /** The message, when it exists and the user sent it, received it or is in its group. */
    public Optional<ChatMessage> findVisible(long uid, long mid) {
        return messageStore.get(mid)
                .flatMap(bytes -> codec.decode(mid, bytes))
                .filter(m -> isVisibleTo(uid, m.payload()));
    }

    private boolean isVisibleTo(long uid, ChatMessagePayload payload) {
        if (payload.fromUid() == uid) return true;
        if (payload.target() instanceof MessageTarget.ToUser toUser) return toUser.uid() == uid;
        if (payload.target() instanceof MessageTarget.ToGroup toGroup) return groupService.isMember(toGroup.gid(), uid);
        return false;
    }

    private long storeDm(long fromUid, long toUid, byte[] bytes) {
        long mid = messageStore.sendToDm(fromUid, toUid, bytes);
        log.debug("User {} sent message {} to user {}", fromUid, mid, toUid);
        updateReadIndexes(mid, () -> readIndexService.recordDmSent(fromUid, toUid, mid));
        return mid;
    }

    private long storeGroup(long fromUid, long gid, Collection<Long> members, byte[] bytes) {
        long mid = messageStore.sendToGroup(gid, members, bytes);
        log.debug("User {} sent message {} to group {}", fromUid, mid, gid);
        updateReadIndexes(mid, () -> readIndexService.recordGroupSent(fromUid, gid, members, mid));
        return mid;
    }

    private void updateReadIndexes(long mid, Runnable update) {
        try {
            update.run();
        } catch (DataAccessException e) {
            log.error("Message {} stored but read indexes were not updated", mid, e);
        }
    }

    int clampLimit(Integer limit) {
        int max = properties.getMaxPageSize();
        if (limit == null) return max;
        return Math.max(1, Math.min(limit, max));
    }

    private void validate(MessageDetail detail) {
        if (detail == null || detail.content() == null || detail.content().isBlank()) {
            throw new ChatValidationException("Message must not be empty");
        }
        if (detail.content().length() > properties.getMaxContentLength()) {
            throw new ChatValidationException(
                    "Message is longer than " + properties.getMaxContentLength() + " characters");
        }
    }

    // a reply may only quote a message of the same conversation
    private void validateReply(long fromUid, MessageTarget target, Long replyTo) {
        if (replyTo == null) return;
        boolean sameConversation = target instanceof MessageTarget.ToUser toUser
                ? messageStore.containsDmMessage(fromUid, toUser.uid(), replyTo)
                : messageStore.containsGroupMessage(((MessageTarget.ToGroup) target).gid(), replyTo);
        if (!sameConversation) {
            throw new ChatValidationException("Message to reply to does not exist");
        }
    }
}
