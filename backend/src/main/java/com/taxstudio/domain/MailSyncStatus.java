package com.taxstudio.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Status of an external mail-account sync job.
 */
public enum MailSyncStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    PAUSED;

    /** Case-insensitive parse of the wire value ({@code completed}, {@code COMPLETED}). */
    public static Optional<MailSyncStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(s -> s.name().equals(v)).findFirst();
    }
}
