package com.taxstudio.api.dto;

import com.taxstudio.domain.SearchAttempt;
import com.taxstudio.domain.TransactionSearchEntry;

import java.time.Instant;
import java.util.List;

/**
 * One precision search run over a transaction, as listed by the history endpoint.
 */
public record SearchHistoryItemResponse(
        String queueId,
        String triggeredBy,
        List<String> strategiesAttempted,
        List<SearchAttempt> attempts,
        String automationSource,
        int totalFilesConnected,
        Instant createdAt
) {

    public static SearchHistoryItemResponse from(TransactionSearchEntry entry) {
        return new SearchHistoryItemResponse(
                entry.getQueueId(),
                entry.getTriggeredBy() != null ? entry.getTriggeredBy().value() : null,
                List.copyOf(entry.getStrategiesAttempted()),
                List.copyOf(entry.getAttempts()),
                entry.getAutomationSource(),
                entry.getTotalFilesConnected(),
                entry.getCreatedAt());
    }
}
