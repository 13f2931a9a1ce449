package com.chatter.chatbackend.chat;

import com.chatter.chatbackend.chat.stream.ChatStreamService;
import com.chatter.chatbackend.user.CurrentUserService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatStreamController {

    private final ChatStreamService streamService;
    private final CurrentUserService currentUserService;

    // EventSource cannot set headers, so the token may also arrive as ?token=
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream() {
        return streamService.open(currentUserService.currentUid());
    }
}
