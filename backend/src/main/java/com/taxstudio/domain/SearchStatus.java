package com.taxstudio.domain;

import java.util.Set;

/**
 * Lifecycle of a precision search queue item: PENDING → PROCESSING → COMPLETED | FAILED.
 * Terminal states are never left.
 */
public enum SearchStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public static final Set<SearchStatus> IN_FLIGHT = Set.of(PENDING, PROCESSING);
    public static final Set<SearchStatus> TERMINAL = Set.of(COMPLETED, FAILED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public String value() {
        return name().toLowerCase();
    }
}
