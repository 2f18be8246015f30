package com.taxstudio.domain;

/**
 * Application event: a precision search queue item was created PENDING. Consumed by the pipeline runner.
 */
public record PrecisionSearchQueuedEvent(String queueId, String userId) {
}
