package com.taxstudio.domain;

/**
 * Non-fatal error recorded on a queue item. {@code transactionId} is null for job-level entries
 * (e.g. an unknown strategy id).
 */
public record SearchError(String transactionId, String strategyId, String message) {
}
