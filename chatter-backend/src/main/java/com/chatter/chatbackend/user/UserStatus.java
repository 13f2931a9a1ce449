package com.chatter.chatbackend.user;

public enum UserStatus {
    NORMAL,
    FREEZE
}
