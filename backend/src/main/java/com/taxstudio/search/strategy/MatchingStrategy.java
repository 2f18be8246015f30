package com.taxstudio.search.strategy;

import com.taxstudio.domain.Transaction;

/**
 * One way of finding receipt candidates for a transaction. Implementations read through
 * {@link SearchContext#store()} only and never mutate transactions or files; failures are reported in the
 * returned {@link StrategyOutcome} instead of being thrown.
 */
public interface MatchingStrategy {

    /** Stable id persisted in queue items (e.g. {@code partner_files}). */
    String id();

    /** Cheap pre-check; a strategy that is not applicable is skipped without recording an attempt error. */
    boolean isApplicable(Transaction transaction, SearchContext context);

    StrategyOutcome search(Transaction transaction, SearchContext context);
}
