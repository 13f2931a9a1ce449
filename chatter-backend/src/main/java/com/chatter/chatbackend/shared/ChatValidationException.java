package com.chatter.chatbackend.shared;

public class ChatValidationException extends RuntimeException {

    public ChatValidationException(String message) {
        super(message);
    }
}
