package com.taxstudio.domain;

/**
 * What caused a precision search to be queued.
 */
public enum SearchTrigger {
    MANUAL("manual"),
    MAIL_SYNC("mail_sync");

    private final String value;

    SearchTrigger(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
