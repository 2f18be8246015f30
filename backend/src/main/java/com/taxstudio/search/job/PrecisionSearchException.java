package com.taxstudio.search.job;

/**
 * Unrecoverable error in a precision search job; the item is marked FAILED and may be retried.
 */
public class PrecisionSearchException extends RuntimeException {

    public PrecisionSearchException(String message) {
        super(message);
    }
}
