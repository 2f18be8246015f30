package com.taxstudio.suggestion;

/**
 * Query suggestion backend failed (timeout, rate limit, HTTP error, unreadable response).
 */
public class QuerySuggestionException extends RuntimeException {

    public QuerySuggestionException(String message) {
        super(message);
    }

    public QuerySuggestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
