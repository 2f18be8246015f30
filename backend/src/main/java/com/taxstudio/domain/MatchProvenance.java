package com.taxstudio.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Audit trail for an automatically attached receipt: which strategy matched, with what confidence,
 * and in which precision search job.
 */
public record MatchProvenance(
        MatchedBy matchedBy,
        String strategyId,
        BigDecimal confidence,
        String fileId,
        String queueId,
        Instant matchedAt) {

    public enum MatchedBy {
        AUTOMATION,
        USER
    }
}
