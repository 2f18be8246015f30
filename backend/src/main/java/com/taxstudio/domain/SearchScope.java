package com.taxstudio.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Which transactions a precision search covers.
 */
public enum SearchScope {
    ALL_INCOMPLETE("all_incomplete"),
    SINGLE_TRANSACTION("single_transaction");

    private final String value;

    SearchScope(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** Parses the wire value ({@code all_incomplete}, {@code single_transaction}); empty for anything else. */
    public static Optional<SearchScope> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.trim();
        return Arrays.stream(values()).filter(s -> s.value.equals(v)).findFirst();
    }
}
