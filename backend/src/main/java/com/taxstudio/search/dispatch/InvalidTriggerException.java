package com.taxstudio.search.dispatch;

/**
 * Trigger request rejected before anything is queued (unknown scope, missing transaction id or user).
 */
public class InvalidTriggerException extends RuntimeException {

    public InvalidTriggerException(String message) {
        super(message);
    }
}
