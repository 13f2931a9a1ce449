package com.chatter.chatbackend.msg;

/**
 * The embedded log could not be read or written. Fails the current call only; the store stays
 * usable for the next one.
 */
public class StoreIoException extends RuntimeException {

    public StoreIoException(String message) {
        super(message);
    }

    public StoreIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
