package com.taxstudio.api.dto;

import com.taxstudio.domain.PrecisionSearchQueueItem;
import com.taxstudio.domain.SearchError;

import java.time.Instant;
import java.util.List;

/**
 * GET /api/v1/precision-search/status/{queueId} response.
 */
public record QueueItemStatusResponse(
        String queueId,
        String scope,
        String transactionId,
        String status,
        String triggeredBy,
        int progressPct,
        int transactionsToProcess,
        int transactionsProcessed,
        int transactionsWithMatches,
        int totalFilesConnected,
        List<String> strategies,
        String currentStrategy,
        List<SearchError> errors,
        int retryCount,
        int maxRetries,
        String lastError,
        Instant nextRetryAfter,
        String retryOf,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt
) {

    public static QueueItemStatusResponse from(PrecisionSearchQueueItem item) {
        List<String> strategies = item.getStrategies();
        int index = item.getCurrentStrategyIndex();
        String current = index >= 0 && index < strategies.size() ? strategies.get(index) : null;
        return new QueueItemStatusResponse(
                item.getId(),
                item.getScope() != null ? item.getScope().value() : null,
                item.getTransactionId(),
                item.getStatus() != null ? item.getStatus().value() : null,
                item.getTriggeredBy() != null ? item.getTriggeredBy().value() : null,
                item.progressPct(),
                item.getTransactionsToProcess(),
                item.getTransactionsProcessed(),
                item.getTransactionsWithMatches(),
                item.getTotalFilesConnected(),
                List.copyOf(strategies),
                current,
                List.copyOf(item.getErrors()),
                item.getRetryCount(),
                item.getMaxRetries(),
                item.getLastError(),
                item.getNextRetryAfter(),
                item.getRetryOf(),
                item.getCreatedAt(),
                item.getStartedAt(),
                item.getCompletedAt());
    }
}
