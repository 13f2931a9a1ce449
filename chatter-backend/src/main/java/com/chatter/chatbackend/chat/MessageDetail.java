package com.chatter.chatbackend.chat;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = MessageDetail.Normal.class, name = "Normal"),
        @JsonSubTypes.Type(value = MessageDetail.Reply.class, name = "Reply")
})
public interface MessageDetail {

    String content();

    /** Id of the message being replied to, null for a plain message. */
    default Long replyTo() {
        return null;
    }

    record Normal(String content) implements MessageDetail {
    }

    record Reply(long mid, String content) implements MessageDetail {
        @Override
        public Long replyTo() {
            return mid;
        }
    }
}
