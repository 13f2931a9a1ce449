package com.chatter.chatbackend.chat.dto;

public record HeartbeatFrame(String time) {
}
