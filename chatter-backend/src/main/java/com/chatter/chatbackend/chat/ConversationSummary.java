package com.chatter.chatbackend.chat;

import com.chatter.chatbackend.readindex.Unread;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

@Data @AllArgsConstructor @NoArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationSummary {
    private MessageTarget target;
    private Long latestMid;
    private Long uidOfLatestMsg;
    private ChatMessage latestMessage;   // null when the payload can no longer be read
    private Unread unread;               // omitted when everything is read
}
