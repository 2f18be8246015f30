package com.taxstudio.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Atomic state transitions on queue items.
 */
public interface PrecisionSearchQueueRepositoryCustom {

    /**
     * PENDING → PROCESSING by compare-and-set on status. Returns the claimed item, or empty when another
     * worker got there first or the item no longer exists.
     */
    Optional<PrecisionSearchQueueItem> claim(String queueId, String workerId, Instant leaseExpiresAt);

    /**
     * Takes over a PROCESSING item whose lease expired before {@code now}. Returns empty if the lease was
     * renewed or another worker took it over in the meantime.
     */
    Optional<PrecisionSearchQueueItem> reclaimStale(String queueId, String workerId, Instant now,
                                                    Instant leaseExpiresAt);

    /** Unsets {@code nextRetryAfter} on a FAILED item so the retry scheduler stops selecting it. */
    void clearRetryMarker(String queueId);

    /** Ids of PROCESSING items whose lease expired before {@code now}. */
    List<String> findStaleProcessingIds(Instant now, int limit);
}
