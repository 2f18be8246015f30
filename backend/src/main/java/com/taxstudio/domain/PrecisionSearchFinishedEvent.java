package com.taxstudio.domain;

/**
 * Application event: a queue item reached COMPLETED or FAILED. No mandatory consumer; audit hook.
 */
public record PrecisionSearchFinishedEvent(String queueId, String userId, SearchStatus status,
                                           int transactionsWithMatches, int totalFilesConnected) {
}
