package com.taxstudio.search.job;

import com.taxstudio.common.RetryPolicy;
import com.taxstudio.domain.MatchProvenance;
import com.taxstudio.domain.PrecisionSearchFinishedEvent;
import com.taxstudio.domain.PrecisionSearchQueueItem;
import com.taxstudio.domain.PrecisionSearchQueueRepository;
import com.taxstudio.domain.SearchAttempt;
import com.taxstudio.domain.SearchError;
import com.taxstudio.domain.SearchScope;
import com.taxstudio.domain.SearchStatus;
import com.taxstudio.domain.Transaction;
import com.taxstudio.domain.TransactionRepository;
import com.taxstudio.search.config.PrecisionSearchProperties;
import com.taxstudio.search.match.SearchHistoryRecorder;
import com.taxstudio.search.match.TransactionMatchWriter;
import com.taxstudio.search.scoring.ConfidenceScorer;
import com.taxstudio.search.scoring.ScoredCandidate;
import com.taxstudio.search.strategy.MatchingStrategy;
import com.taxstudio.search.strategy.SearchContext;
import com.taxstudio.search.strategy.SearchStore;
import com.taxstudio.search.strategy.StrategyOutcome;
import com.taxstudio.search.strategy.StrategyRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one precision search queue item to a terminal state.
 * <p>
 * Strategy-major: every scoped transaction is tried against strategy {@code currentStrategyIndex} before
 * the index advances. A transaction leaves the loop once a file is attached (resolved); it counts as
 * processed when resolved or after the last strategy. The item is saved after every transaction, which
 * renews the lease; an optimistic-lock failure on save means another worker took the item over, and this
 * worker stops without touching it further.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PrecisionSearchExecutor {

    private final PrecisionSearchQueueRepository queueRepository;
    private final TransactionRepository transactionRepository;
    private final StrategyRegistry strategyRegistry;
    private final ConfidenceScorer confidenceScorer;
    private final TransactionMatchWriter matchWriter;
    private final SearchHistoryRecorder historyRecorder;
    private final SearchStore searchStore;
    private final PrecisionSearchProperties properties;
    private final RetryPolicy retryPolicy;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final String workerId = "worker-" + UUID.randomUUID();

    /** Claims a PENDING item and runs it. No-op when the item is gone or already claimed. */
    public void claimAndRun(String queueId) {
        Optional<PrecisionSearchQueueItem> claimed = queueRepository.claim(queueId, workerId, leaseUntil());
        if (claimed.isEmpty()) {
            log.debug("Precision search {} not pending, skipping", queueId);
            return;
        }
        log.info("Claimed precision search {} for user {} ({})",
                queueId, claimed.get().getUserId(), workerId);
        run(claimed.get());
    }

    /** Takes over a PROCESSING item whose lease expired and resumes it from its persisted cursor. */
    public void resumeStale(String queueId) {
        Optional<PrecisionSearchQueueItem> reclaimed =
                queueRepository.reclaimStale(queueId, workerId, Instant.now(), leaseUntil());
        if (reclaimed.isEmpty()) {
            log.debug("Precision search {} no longer stale, skipping", queueId);
            return;
        }
        log.info("Resuming stale precision search {} at strategy index {} ({})",
                queueId, reclaimed.get().getCurrentStrategyIndex(), workerId);
        run(reclaimed.get());
    }

    void run(PrecisionSearchQueueItem item) {
        try {
            process(item);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Lost lease on precision search {}; another worker continues it", item.getId());
        } catch (Exception e) {
            log.error("Precision search {} failed: {}", item.getId(), e.getMessage(), e);
            fail(item, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void process(PrecisionSearchQueueItem item) {
        if (!item.isScopeSnapshotTaken()) {
            item = snapshotScope(item);
        }
        if (item.getTransactionIds().isEmpty() || item.getStrategies().isEmpty()) {
            complete(item);
            return;
        }
        SearchContext context = new SearchContext(item.getUserId(), item.getId(), searchStore);

        while (true) {
            int index = item.getCurrentStrategyIndex();
            String strategyId = item.getStrategies().get(index);
            boolean lastStrategy = index == item.getStrategies().size() - 1;
            Optional<MatchingStrategy> strategy = strategyRegistry.find(strategyId);
            if (strategy.isEmpty()) {
                log.warn("Precision search {}: unknown strategy '{}', skipping", item.getId(), strategyId);
                item.getErrors().add(new SearchError(null, strategyId, "Unknown strategy: " + strategyId));
            } else {
                for (String transactionId : List.copyOf(item.getTransactionIds())) {
                    if (item.getResolvedTransactionIds().contains(transactionId)
                            || item.getAttemptedTransactionIds().contains(transactionId)) {
                        continue;
                    }
                    attempt(item, strategy.get(), transactionId, context, lastStrategy);
                    item.getAttemptedTransactionIds().add(transactionId);
                    item = saveProgress(item);
                }
            }
            if (allResolved(item) || lastStrategy) {
                complete(item);
                return;
            }
            item.setCurrentStrategyIndex(index + 1);
            item.getAttemptedTransactionIds().clear();
            item = saveProgress(item);
        }
    }

    /** First claim: freezes which transactions this item covers. */
    private PrecisionSearchQueueItem snapshotScope(PrecisionSearchQueueItem item) {
        List<String> ids;
        if (item.getScope() == SearchScope.SINGLE_TRANSACTION) {
            Transaction tx = transactionRepository.findByIdAndUserId(item.getTransactionId(), item.getUserId())
                    .orElseThrow(() -> new PrecisionSearchException(
                            "Transaction " + item.getTransactionId() + " not found for user " + item.getUserId()));
            ids = List.of(tx.getId());
        } else if (item.getScope() == SearchScope.ALL_INCOMPLETE) {
            int limit = item.getTransactionsToProcess();
            ids = limit <= 0 ? List.of() : transactionRepository
                    .findByUserIdAndCompleteFalseOrderByDateDesc(item.getUserId(), PageRequest.of(0, limit))
                    .stream()
                    .map(Transaction::getId)
                    .toList();
        } else {
            throw new PrecisionSearchException("Unreadable scope on precision search " + item.getId());
        }
        if (ids.size() != item.getTransactionsToProcess()) {
            log.info("Precision search {}: {} transactions in scope (queued with {})",
                    item.getId(), ids.size(), item.getTransactionsToProcess());
            item.setTransactionsToProcess(ids.size());
        }
        item.setTransactionIds(new ArrayList<>(ids));
        return saveProgress(item);
    }

    private void attempt(PrecisionSearchQueueItem item, MatchingStrategy strategy, String transactionId,
                         SearchContext context, boolean lastStrategy) {
        Optional<Transaction> found = transactionRepository.findByIdAndUserId(transactionId, item.getUserId());
        if (found.isEmpty()) {
            item.getErrors().add(new SearchError(transactionId, strategy.id(), "Transaction not found"));
            resolve(item, transactionId);
            return;
        }
        Transaction tx = found.get();
        if (tx.isComplete()) {
            MatchProvenance provenance = tx.getMatchProvenance();
            if (provenance != null && item.getId().equals(provenance.queueId())) {
                // attached by this item before an interrupted save
                matchWriter.ensureFileLinked(tx);
                item.setTransactionsWithMatches(item.getTransactionsWithMatches() + 1);
                item.setTotalFilesConnected(item.getTotalFilesConnected() + 1);
            }
            log.debug("Transaction {} already complete, skipping", transactionId);
            resolve(item, transactionId);
            return;
        }
        if (!strategy.isApplicable(tx, context)) {
            if (lastStrategy) {
                item.setTransactionsProcessed(item.getTransactionsProcessed() + 1);
            }
            return;
        }

        Instant startedAt = Instant.now();
        StrategyOutcome outcome = runStrategy(strategy, tx, context);
        if (outcome.hasError()) {
            log.warn("Strategy {} failed for transaction {} in precision search {}: {}",
                    strategy.id(), transactionId, item.getId(), outcome.error());
            item.getErrors().add(new SearchError(transactionId, strategy.id(), outcome.error()));
        }
        List<ScoredCandidate> ranked = confidenceScorer.rank(outcome.candidates());
        Optional<ScoredCandidate> best = confidenceScorer.best(ranked);
        List<String> connected = List.of();
        if (best.isPresent() && matchWriter.attach(tx, best.get(), strategy.id(), item.getId())) {
            connected = List.of(best.get().fileId());
            item.setTransactionsWithMatches(item.getTransactionsWithMatches() + 1);
            item.setTotalFilesConnected(item.getTotalFilesConnected() + 1);
            resolve(item, transactionId);
            log.debug("Precision search {}: {} matched file {} to transaction {} (confidence {})",
                    item.getId(), strategy.id(), best.get().fileId(), transactionId, best.get().confidence());
        } else if (lastStrategy) {
            item.setTransactionsProcessed(item.getTransactionsProcessed() + 1);
        }

        int accepted = (int) ranked.stream().filter(sc -> confidenceScorer.isAccepted(sc.confidence())).count();
        historyRecorder.record(item, transactionId, new SearchAttempt(strategy.id(), startedAt, Instant.now(),
                ranked.size(), accepted, ranked.isEmpty() ? null : ranked.get(0).confidence(), connected,
                outcome.error()));
    }

    /** Store failures propagate and fail the job; anything else a strategy throws is a non-fatal error. */
    private static StrategyOutcome runStrategy(MatchingStrategy strategy, Transaction tx, SearchContext context) {
        try {
            return strategy.search(tx, context);
        } catch (DataAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            return StrategyOutcome.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static void resolve(PrecisionSearchQueueItem item, String transactionId) {
        if (item.getResolvedTransactionIds().add(transactionId)) {
            item.setTransactionsProcessed(item.getTransactionsProcessed() + 1);
        }
    }

    private static boolean allResolved(PrecisionSearchQueueItem item) {
        return item.getResolvedTransactionIds().containsAll(item.getTransactionIds());
    }

    private PrecisionSearchQueueItem saveProgress(PrecisionSearchQueueItem item) {
        Instant now = Instant.now();
        item.setUpdatedAt(now);
        item.setLeaseExpiresAt(leaseUntil());
        return queueRepository.save(item);
    }

    private void complete(PrecisionSearchQueueItem item) {
        Instant now = Instant.now();
        int scoped = item.getTransactionIds() != null ? item.getTransactionIds().size() : 0;
        if (item.getTransactionsProcessed() < scoped) {
            // last strategy unknown: remaining transactions were never attempted there
            item.setTransactionsProcessed(scoped);
        }
        item.setStatus(SearchStatus.COMPLETED);
        item.setCompletedAt(now);
        item.setUpdatedAt(now);
        item.setInFlightKey(null);
        item.setLeaseExpiresAt(null);
        queueRepository.save(item);
        log.info("Precision search {} COMPLETED for user {}: {}/{} processed, {} matched, {} files connected, {} errors",
                item.getId(), item.getUserId(), item.getTransactionsProcessed(), item.getTransactionsToProcess(),
                item.getTransactionsWithMatches(), item.getTotalFilesConnected(), item.getErrors().size());
        publishFinished(item);
    }

    private void fail(PrecisionSearchQueueItem item, String reason) {
        Instant now = Instant.now();
        item.setStatus(SearchStatus.FAILED);
        item.setRetryCount(item.getRetryCount() + 1);
        item.setLastError(reason);
        item.setCompletedAt(now);
        item.setUpdatedAt(now);
        item.setNextRetryAfter(item.getRetryCount() < item.getMaxRetries()
                ? now.plus(retryPolicy.delayFor(item.getRetryCount()))
                : null);
        item.setInFlightKey(null);
        item.setLeaseExpiresAt(null);
        try {
            queueRepository.save(item);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Lost lease on precision search {} while marking it failed", item.getId());
            return;
        } catch (DataAccessException e) {
            log.error("Could not mark precision search {} failed; stale sweep will pick it up", item.getId(), e);
            return;
        }
        log.warn("Precision search {} FAILED (retry {}/{}{}): {}", item.getId(), item.getRetryCount(),
                item.getMaxRetries(), item.getNextRetryAfter() != null ? ", next at " + item.getNextRetryAfter() : "",
                reason);
        publishFinished(item);
    }

    private void publishFinished(PrecisionSearchQueueItem item) {
        applicationEventPublisher.publishEvent(new PrecisionSearchFinishedEvent(item.getId(), item.getUserId(),
                item.getStatus(), item.getTransactionsWithMatches(), item.getTotalFilesConnected()));
    }

    private Instant leaseUntil() {
        return Instant.now().plusMillis(properties.getLeaseDurationMs());
    }
}
