package com.chatter.chatbackend.group;

import com.chatter.chatbackend.shared.RecipientResolutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class GroupService {

    private final ChatGroupRepository groupRepo;
    private final GroupMemberRepository memberRepo;

    /** Current member ids of the group, ascending. */
    public List<Long> getMemberIds(long groupId) {
        try {
            if (!groupRepo.existsById(groupId)) {
                throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Group not found");
            }
            return memberRepo.findMemberIds(groupId);
        } catch (DataAccessException e) {
            log.error("Failed to load members of group {}", groupId, e);
            throw new RecipientResolutionException("Could not load group members", e);
        }
    }

    /**
     * Members a message from {@code senderUid} fans out to. The sender has to be a member that is
     * not muted.
     */
    public List<Long> getSendableMemberIds(long groupId, long senderUid) {
        GroupMember sender = requireMember(groupId, senderUid);
        if (sender.isForbid()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "You are muted in this group");
        }
        return getMemberIds(groupId);
    }

    public GroupMember requireMember(long groupId, long uid) {
        try {
            if (!groupRepo.existsById(groupId)) {
                throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Group not found");
            }
            return memberRepo.findByGroupIdAndUserId(groupId, uid)
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.FORBIDDEN, "Not a member of this group"));
        } catch (DataAccessException e) {
            log.error("Failed to check membership of user {} in group {}", uid, groupId, e);
            throw new RecipientResolutionException("Could not check group membership", e);
        }
    }

    public boolean isMember(long groupId, long uid) {
        return memberRepo.existsByGroupIdAndUserId(groupId, uid);
    }

    @Transactional
    public ChatGroup createGroup(long adminUid, String name, Collection<Long> memberIds) {
        if (name == null || name.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Group name is required");
        }
        ChatGroup group = new ChatGroup();
        group.setName(name.trim());
        group.setAdminUid(adminUid);
        ChatGroup saved = groupRepo.save(group);

        Set<Long> members = new LinkedHashSet<>();
        members.add(adminUid);
        if (memberIds != null) members.addAll(memberIds);
        for (Long uid : members) {
            GroupMember m = new GroupMember();
            m.setGroupId(saved.getId());
            m.setUserId(uid);
            memberRepo.save(m);
        }
        log.info("Group {} created by {} with {} members", saved.getId(), adminUid, members.size());
        return saved;
    }

    @Transactional
    public void addMember(long actingUid, long groupId, long uid) {
        ChatGroup group = requireAdmin(actingUid, groupId);
        if (memberRepo.existsByGroupIdAndUserId(group.getId(), uid)) return;
        GroupMember m = new GroupMember();
        m.setGroupId(group.getId());
        m.setUserId(uid);
        memberRepo.save(m);
    }

    @Transactional
    public void setForbid(long actingUid, long groupId, long uid, boolean forbid) {
        requireAdmin(actingUid, groupId);
        GroupMember m = memberRepo.findByGroupIdAndUserId(groupId, uid)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Member not found"));
        m.setForbid(forbid);
        memberRepo.save(m);
    }

    private ChatGroup requireAdmin(long actingUid, long groupId) {
        ChatGroup group = groupRepo.findById(groupId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Group not found"));
        if (!group.getAdminUid().equals(actingUid)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Only the group admin can do this");
        }
        return group;
    }
}
