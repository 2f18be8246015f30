package com.taxstudio.domain;

/**
 * Who initiated a change: a user acting through the API or the system (event/retry driven).
 */
public record ChangeAuthor(AuthorType type, String userId) {

    public enum AuthorType {
        USER,
        SYSTEM
    }

    public static ChangeAuthor user(String userId) {
        return new ChangeAuthor(AuthorType.USER, userId);
    }

    public static ChangeAuthor system(String onBehalfOfUserId) {
        return new ChangeAuthor(AuthorType.SYSTEM, onBehalfOfUserId);
    }
}
