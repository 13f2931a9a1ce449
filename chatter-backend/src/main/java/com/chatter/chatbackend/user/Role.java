package com.chatter.chatbackend.user;

public enum Role {
    USER,
    ADMIN
}
