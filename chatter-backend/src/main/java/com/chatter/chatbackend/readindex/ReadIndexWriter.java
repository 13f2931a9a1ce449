package com.chatter.chatbackend.readindex;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Find-then-save upserts of read-index rows. Each public method is one transaction so the caller
 * can retry it as a whole after losing an insert race.
 */
@Component
@RequiredArgsConstructor
class ReadIndexWriter {

    private final ReadIndexRepository repo;

    @Transactional
    public void writeDm(long actingUid, long targetUid, long mid, boolean acknowledge) {
        upsert(repo.findByUidAndTargetUid(actingUid, targetUid),
                () -> ReadIndex.builder().uid(actingUid).targetUid(targetUid),
                actingUid, mid, acknowledge);
        if (targetUid != actingUid) {
            upsert(repo.findByUidAndTargetUid(targetUid, actingUid),
                    () -> ReadIndex.builder().uid(targetUid).targetUid(actingUid),
                    actingUid, mid, false);
        }
    }

    @Transactional
    public void writeGroup(long actingUid, long groupId, Collection<Long> memberIds, long mid, boolean acknowledge) {
        upsert(repo.findByUidAndTargetGid(actingUid, groupId),
                () -> ReadIndex.builder().uid(actingUid).targetGid(groupId),
                actingUid, mid, acknowledge);
        for (Long member : memberIds) {
            if (member == actingUid) continue;
            upsert(repo.findByUidAndTargetGid(member, groupId),
                    () -> ReadIndex.builder().uid(member).targetGid(groupId),
                    actingUid, mid, false);
        }
    }

    private void upsert(Optional<ReadIndex> existing,
                        Supplier<ReadIndex.ReadIndexBuilder> fresh,
                        long senderUid,
                        long mid,
                        boolean acknowledge) {
        ReadIndex row = existing.orElseGet(() -> fresh.get()
                .latestMid(mid)
                .uidOfLatestMsg(senderUid)
                .build());

        // latest pointer never goes backwards
        if (row.getLatestMid() < mid) {
            row.setLatestMid(mid);
            row.setUidOfLatestMsg(senderUid);
        }
        if (acknowledge && (row.getMid() == null || row.getMid() < mid)) {
            row.setMid(mid);
        }
        repo.save(row);
    }
}
