package com.chatter.chatbackend.chat;

import com.chatter.chatbackend.chat.dto.SendMessageRequest;
import com.chatter.chatbackend.user.CurrentUserService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatController {

    private final ChatMessageService chatMessageService;
    private final ConversationService conversationService;
    private final CurrentUserService currentUserService;

    @PostMapping("/user/{uid}")
    public ChatMessage sendToUser(@PathVariable long uid, @RequestBody SendMessageRequest body) {
        return chatMessageService.send(currentUserService.currentUid(), new MessageTarget.ToUser(uid), body.toDetail());
    }

    @PostMapping("/group/{gid}")
    public ChatMessage sendToGroup(@PathVariable long gid, @RequestBody SendMessageRequest body) {
        return chatMessageService.send(currentUserService.currentUid(), new MessageTarget.ToGroup(gid), body.toDetail());
    }

    @GetMapping("/user/{uid}/history")
    public List<ChatMessage> userHistory(
            @PathVariable long uid,
            @RequestParam(required = false) Long before,
            @RequestParam(required = false) Integer limit
    ) {
        return chatMessageService.history(currentUserService.currentUid(), new MessageTarget.ToUser(uid), before, limit);
    }

    @GetMapping("/group/{gid}/history")
    public List<ChatMessage> groupHistory(
            @PathVariable long gid,
            @RequestParam(required = false) Long before,
            @RequestParam(required = false) Integer limit
    ) {
        return chatMessageService.history(currentUserService.currentUid(), new MessageTarget.ToGroup(gid), before, limit);
    }

    @GetMapping("/sync")
    public List<ChatMessage> sync(
            @RequestParam(required = false) Long after,
            @RequestParam(required = false) Integer limit
    ) {
        return chatMessageService.sync(currentUserService.currentUid(), after, limit);
    }

    @GetMapping("/messages")
    public List<ChatMessage> byIds(@RequestParam List<Long> mids) {
        return chatMessageService.getByMids(currentUserService.currentUid(), mids);
    }

    @GetMapping("/list")
    public List<ConversationSummary> conversations() {
        return conversationService.listConversations(currentUserService.currentUid());
    }
}
