package com.taxstudio.search.strategy;

/**
 * Explicit per-job context threaded through every strategy call.
 */
public record SearchContext(String userId, String queueId, SearchStore store) {
}
