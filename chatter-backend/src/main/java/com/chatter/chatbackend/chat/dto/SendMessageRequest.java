package com.chatter.chatbackend.chat.dto;

import com.chatter.chatbackend.chat.MessageDetail;

/** Body of a send: the text and, for a reply, the id being answered. */
public record SendMessageRequest(String msg, Long replyTo) {

    public MessageDetail toDetail() {
        return replyTo == null
                ? new MessageDetail.Normal(msg)
                : new MessageDetail.Reply(replyTo, msg);
    }
}
