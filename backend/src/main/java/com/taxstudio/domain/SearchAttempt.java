package com.taxstudio.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * One strategy run against one transaction.
 *
 * @param candidatesFound    candidates returned by the strategy
 * @param candidatesAccepted candidates at or above the acceptance threshold
 * @param bestConfidence     highest confidence seen, null when there were no candidates
 */
public record SearchAttempt(
        String strategyId,
        Instant startedAt,
        Instant completedAt,
        int candidatesFound,
        int candidatesAccepted,
        BigDecimal bestConfidence,
        List<String> fileIdsConnected,
        String error) {
}
