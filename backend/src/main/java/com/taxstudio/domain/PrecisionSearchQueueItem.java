package com.taxstudio.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One precision search job and its state machine. Created PENDING by the dispatcher, claimed into
 * PROCESSING by exactly one runner (compare-and-set on status, then a renewable lease), and frozen once
 * COMPLETED or FAILED. Retries are new items pointing back through {@code retryOf}.
 * <p>
 * {@code inFlightKey} holds the userId while the item is PENDING or PROCESSING and is unset on terminal
 * transitions; its unique sparse index guarantees at most one in-flight item per user.
 * <p>
 * The cursor fields ({@code transactionIds}, {@code resolvedTransactionIds},
 * {@code attemptedTransactionIds}, {@code currentStrategyIndex}) let a re-claimed item resume where a
 * crashed worker stopped.
 */
@Document(collection = "precision_search_queue")
@CompoundIndexes({
    @CompoundIndex(name = "user_status", def = "{'userId': 1, 'status': 1}"),
    @CompoundIndex(name = "status_created", def = "{'status': 1, 'createdAt': 1}"),
    @CompoundIndex(name = "status_lease", def = "{'status': 1, 'leaseExpiresAt': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PrecisionSearchQueueItem {

    public static final int DEFAULT_MAX_RETRIES = 3;

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Version
    private Long version;

    private String userId;
    private SearchScope scope;
    private String transactionId;
    private SearchStatus status;
    private SearchTrigger triggeredBy;
    private ChangeAuthor triggeredByAuthor;
    private String mailSyncJobId;

    private List<String> strategies = new ArrayList<>();
    private int currentStrategyIndex;

    private int transactionsToProcess;
    private int transactionsProcessed;
    private int transactionsWithMatches;
    private int totalFilesConnected;

    /** Scope snapshot taken on first claim; null until then. */
    private List<String> transactionIds;
    private Set<String> resolvedTransactionIds = new LinkedHashSet<>();
    /** Transactions already attempted against the strategy at {@code currentStrategyIndex}. */
    private Set<String> attemptedTransactionIds = new LinkedHashSet<>();

    private List<SearchError> errors = new ArrayList<>();
    private int retryCount;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private String lastError;
    private Instant nextRetryAfter;
    @Indexed(sparse = true)
    private String retryOf;

    @Indexed(unique = true, sparse = true)
    private String inFlightKey;
    private String workerId;
    private Instant leaseExpiresAt;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant startedAt;
    private Instant completedAt;

    public boolean isScopeSnapshotTaken() {
        return transactionIds != null;
    }

    /** Progress 0-100 from processed/toProcess; 0 when nothing is in scope yet. */
    public int progressPct() {
        if (transactionsToProcess <= 0) {
            return status == SearchStatus.COMPLETED ? 100 : 0;
        }
        return (int) Math.round(100.0 * transactionsProcessed / transactionsToProcess);
    }

    public boolean isRetryable() {
        return status == SearchStatus.FAILED && retryCount < maxRetries;
    }
}
