package com.taxstudio.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence for precision_search_queue. State transitions that must be atomic (claim, stale re-claim)
 * live in {@link PrecisionSearchQueueRepositoryCustom}.
 */
public interface PrecisionSearchQueueRepository
        extends MongoRepository<PrecisionSearchQueueItem, String>, PrecisionSearchQueueRepositoryCustom {

    Optional<PrecisionSearchQueueItem> findFirstByUserIdAndStatusInOrderByCreatedAtDesc(
            String userId, Collection<SearchStatus> statuses);

    List<PrecisionSearchQueueItem> findByStatusOrderByCreatedAtAsc(SearchStatus status, Pageable pageable);

    /**
     * Failed items whose retry is due, earliest first (retryCount/maxRetries checked by the caller). Items
     * leave this query once their retry is queued, see {@link #clearRetryMarker(String)}.
     */
    List<PrecisionSearchQueueItem> findByStatusAndNextRetryAfterLessThanEqualOrderByNextRetryAfterAsc(
            SearchStatus status, Instant cutoff, Pageable pageable);

    boolean existsByRetryOf(String retryOf);

    /** Retention cleanup of terminal items. */
    void deleteByStatusInAndCompletedAtBefore(Set<SearchStatus> statuses, Instant cutoff);
}
