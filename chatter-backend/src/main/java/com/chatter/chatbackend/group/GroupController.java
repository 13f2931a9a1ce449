package com.chatter.chatbackend.group;

import com.chatter.chatbackend.user.CurrentUserService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/** Only the membership plumbing messaging needs; no group profile management. */
@RestController
@RequestMapping("/api/group")
@RequiredArgsConstructor
public class GroupController {

    private final GroupService groupService;
    private final CurrentUserService currentUserService;

    public record CreateGroupRequest(String name, List<Long> memberIds) {}

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> create(@RequestBody CreateGroupRequest body) {
        ChatGroup group = groupService.createGroup(currentUserService.currentUid(), body.name(), body.memberIds());
        return Map.of("id", group.getId(), "name", group.getName());
    }

    @GetMapping("/{gid}/members")
    public List<Long> members(@PathVariable long gid) {
        groupService.requireMember(gid, currentUserService.currentUid());
        return groupService.getMemberIds(gid);
    }

    @PostMapping("/{gid}/members/{uid}")
    public void addMember(@PathVariable long gid, @PathVariable long uid) {
        groupService.addMember(currentUserService.currentUid(), gid, uid);
    }

    @PutMapping("/{gid}/members/{uid}/forbid")
    public void forbid(@PathVariable long gid, @PathVariable long uid, @RequestParam boolean value) {
        groupService.setForbid(currentUserService.currentUid(), gid, uid, value);
    }
}
