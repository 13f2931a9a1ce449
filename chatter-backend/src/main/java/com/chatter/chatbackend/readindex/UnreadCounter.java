package com.chatter.chatbackend.readindex;

import com.chatter.chatbackend.msg.MessageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class UnreadCounter {

    private final MessageStore messageStore;

    /**
     * Unread marker for one read-index row; empty when nothing is unread or the row names no
     * single conversation.
     */
    public Optional<Unread> countUnread(ReadIndex row) {
        long count;
        if (row.isDm()) {
            if (row.getMid() == null) return Optional.of(Unread.ALL);
            count = messageStore.countDmMessagesAfter(row.getUid(), row.getTargetUid(), row.getMid());
        } else if (row.isGroup()) {
            if (row.getMid() == null) return Optional.of(Unread.ALL);
            count = messageStore.countGroupMessagesAfter(row.getTargetGid(), row.getMid());
        } else {
            log.warn("Read index {} has no single target, ignoring", row.getId());
            return Optional.empty();
        }
        return count > 0 ? Optional.of(Unread.of(count)) : Optional.empty();
    }
}
