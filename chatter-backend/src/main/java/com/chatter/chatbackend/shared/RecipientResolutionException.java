package com.chatter.chatbackend.shared;

/**
 * The recipients of a message could not be determined because a collaborator (relational store,
 * graph service) failed. Nothing was stored; the caller may resubmit.
 */
public class RecipientResolutionException extends RuntimeException {

    public RecipientResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
