package com.chatter.chatbackend.readindex;

import com.chatter.chatbackend.group.GroupService;
import com.chatter.chatbackend.msg.MessageStore;
import com.chatter.chatbackend.shared.ChatValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * Keeps the per-user conversation pointers in step with sends and acknowledgements.
 * <p>
 * The acting user's row gets both its ack and latest pointers moved; every other participant
 * only has the latest pointer (and its sender) moved, so their unread count grows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReadIndexService {

    private final ReadIndexWriter writer;
    private final ReadIndexRepository repo;
    private final GroupService groupService;
    private final MessageStore messageStore;

    /**
     * Explicit acknowledgement coming from {@code PUT /api/read-index}. The message has to belong
     * to the acknowledged conversation, so a DM can only be acked by one of its two parties.
     */
    public void setReadIndex(long actingUid, UpdateReadIndex update) {
        long mid = update.mid();
        if (mid > messageStore.lastMessageId()) {
            throw new ChatValidationException("Unknown message id " + mid);
        }
        if (update instanceof UpdateReadIndex.User user) {
            if (!messageStore.containsDmMessage(actingUid, user.targetUid(), mid)) {
                throw new ChatValidationException("Message " + mid + " is not part of this conversation");
            }
            withRetry(() -> writer.writeDm(actingUid, user.targetUid(), mid, true));
        } else if (update instanceof UpdateReadIndex.Group group) {
            groupService.requireMember(group.targetGid(), actingUid);
            if (!messageStore.containsGroupMessage(group.targetGid(), mid)) {
                throw new ChatValidationException("Message " + mid + " is not part of this conversation");
            }
            List<Long> members = groupService.getMemberIds(group.targetGid());
            withRetry(() -> writer.writeGroup(actingUid, group.targetGid(), members, mid, true));
        }
    }

    /** A DM was just stored; the sender has implicitly read it. */
    public void recordDmSent(long fromUid, long toUid, long mid) {
        withRetry(() -> writer.writeDm(fromUid, toUid, mid, true));
    }

    public void recordGroupSent(long fromUid, long groupId, Collection<Long> memberIds, long mid) {
        withRetry(() -> writer.writeGroup(fromUid, groupId, memberIds, mid, true));
    }

    public List<ReadIndex> listForUser(long uid) {
        return repo.findByUidOrderByLatestMidDesc(uid);
    }

    // a concurrent first insert of the same (uid, target) loses on the unique key; the second
    // attempt finds the row and updates it
    private void withRetry(Runnable write) {
        try {
            write.run();
        } catch (DataIntegrityViolationException e) {
            log.debug("Read index insert raced, retrying: {}", e.getMessage());
            write.run();
        }
    }
}
