package com.taxstudio.search.dispatch;

import com.taxstudio.domain.ChangeAuthor;
import com.taxstudio.domain.PrecisionSearchQueueItem;
import com.taxstudio.domain.PrecisionSearchQueueRepository;
import com.taxstudio.domain.PrecisionSearchQueuedEvent;
import com.taxstudio.domain.SearchScope;
import com.taxstudio.domain.SearchStatus;
import com.taxstudio.domain.SearchTrigger;
import com.taxstudio.domain.TransactionRepository;
import com.taxstudio.search.config.PrecisionSearchProperties;
import com.taxstudio.search.strategy.StrategyRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Creates precision search queue items. At most one item per user is PENDING or PROCESSING: callers get the
 * in-flight item back (manual trigger) or are declined (mail sync, retry). Concurrent creators race on the
 * unique {@code inFlightKey} index; the loser resolves to the winner.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PrecisionSearchDispatcher {

    private final PrecisionSearchQueueRepository queueRepository;
    private final TransactionRepository transactionRepository;
    private final StrategyRegistry strategyRegistry;
    private final PrecisionSearchProperties properties;
    private final ApplicationEventPublisher applicationEventPublisher;

    /**
     * Manual trigger.
     *
     * @param scope         wire value: {@code all_incomplete} or {@code single_transaction}
     * @param transactionId required for {@code single_transaction}, ignored otherwise
     * @return id of the new item, or of the item already in flight for the user
     * @throws InvalidTriggerException on invalid input; nothing is queued
     */
    public String trigger(String userId, String scope, String transactionId) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidTriggerException("User id is required");
        }
        SearchScope parsed = SearchScope.fromValue(scope).orElseThrow(() -> new InvalidTriggerException(
                "Invalid scope '" + scope + "'; expected all_incomplete or single_transaction"));
        if (parsed == SearchScope.SINGLE_TRANSACTION && (transactionId == null || transactionId.isBlank())) {
            throw new InvalidTriggerException("transactionId is required for scope single_transaction");
        }

        for (int attempt = 0; attempt < 2; attempt++) {
            Optional<PrecisionSearchQueueItem> inFlight = findInFlight(userId);
            if (inFlight.isPresent()) {
                log.info("Precision search already {} for user {}: {}",
                        inFlight.get().getStatus().value(), userId, inFlight.get().getId());
                return inFlight.get().getId();
            }
            PrecisionSearchQueueItem item = newItem(userId, parsed,
                    parsed == SearchScope.SINGLE_TRANSACTION ? transactionId.trim() : null,
                    SearchTrigger.MANUAL, ChangeAuthor.user(userId));
            Optional<PrecisionSearchQueueItem> saved = insert(item);
            if (saved.isPresent()) {
                return saved.get().getId();
            }
        }
        return findInFlight(userId).map(PrecisionSearchQueueItem::getId)
                .orElseThrow(() -> new IllegalStateException("Could not enqueue precision search for user " + userId));
    }

    /**
     * Mail-sync completion trigger. Declines when an item is already in flight or the user has no incomplete
     * transactions.
     */
    public Optional<String> triggerFromMailSync(String userId, String mailSyncJobId) {
        Optional<PrecisionSearchQueueItem> inFlight = findInFlight(userId);
        if (inFlight.isPresent()) {
            log.info("Mail sync {} for user {}: precision search {} already in flight, not queueing",
                    mailSyncJobId, userId, inFlight.get().getId());
            return Optional.empty();
        }
        if (transactionRepository.countByUserIdAndCompleteFalse(userId) == 0) {
            log.info("Mail sync {} for user {}: no incomplete transactions, not queueing", mailSyncJobId, userId);
            return Optional.empty();
        }
        PrecisionSearchQueueItem item = newItem(userId, SearchScope.ALL_INCOMPLETE, null,
                SearchTrigger.MAIL_SYNC, ChangeAuthor.system(userId));
        item.setMailSyncJobId(mailSyncJobId);
        return insert(item).map(PrecisionSearchQueueItem::getId);
    }

    /**
     * New PENDING item retrying {@code failed}: same scope, trigger and author, retry count carried over.
     * Empty when the user has another item in flight.
     */
    public Optional<String> enqueueRetry(PrecisionSearchQueueItem failed) {
        if (findInFlight(failed.getUserId()).isPresent()) {
            log.debug("Retry of {} deferred: user {} has a precision search in flight",
                    failed.getId(), failed.getUserId());
            return Optional.empty();
        }
        PrecisionSearchQueueItem item = newItem(failed.getUserId(), failed.getScope(), failed.getTransactionId(),
                failed.getTriggeredBy(), failed.getTriggeredByAuthor());
        item.setMailSyncJobId(failed.getMailSyncJobId());
        item.setRetryOf(failed.getId());
        item.setRetryCount(failed.getRetryCount());
        item.setMaxRetries(failed.getMaxRetries());
        return insert(item).map(PrecisionSearchQueueItem::getId);
    }

    /** Queue item by id, only when it belongs to {@code userId}. */
    public Optional<PrecisionSearchQueueItem> findForUser(String queueId, String userId) {
        return queueRepository.findById(queueId).filter(item -> userId.equals(item.getUserId()));
    }

    private Optional<PrecisionSearchQueueItem> findInFlight(String userId) {
        return queueRepository.findFirstByUserIdAndStatusInOrderByCreatedAtDesc(userId, SearchStatus.IN_FLIGHT);
    }

    private PrecisionSearchQueueItem newItem(String userId, SearchScope scope, String transactionId,
                                             SearchTrigger trigger, ChangeAuthor author) {
        Instant now = Instant.now();
        PrecisionSearchQueueItem item = new PrecisionSearchQueueItem();
        item.setUserId(userId);
        item.setScope(scope);
        item.setTransactionId(transactionId);
        item.setStatus(SearchStatus.PENDING);
        item.setTriggeredBy(trigger);
        item.setTriggeredByAuthor(author);
        item.setStrategies(new ArrayList<>(strategyRegistry.defaultOrder()));
        item.setCurrentStrategyIndex(0);
        item.setTransactionsToProcess(scope == SearchScope.SINGLE_TRANSACTION
                ? 1
                : (int) transactionRepository.countByUserIdAndCompleteFalse(userId));
        item.setMaxRetries(properties.getMaxRetries());
        item.setInFlightKey(userId);
        item.setCreatedAt(now);
        item.setUpdatedAt(now);
        return item;
    }

    /** Empty when another item for the same user won the in-flight slot. */
    private Optional<PrecisionSearchQueueItem> insert(PrecisionSearchQueueItem item) {
        PrecisionSearchQueueItem saved;
        try {
            saved = queueRepository.insert(item);
        } catch (DuplicateKeyException e) {
            log.info("Concurrent precision search enqueue for user {}; keeping the existing item", item.getUserId());
            return Optional.empty();
        }
        log.info("Queued precision search {} for user {} (scope={}, trigger={}, transactions={}{})",
                saved.getId(), saved.getUserId(), saved.getScope().value(), saved.getTriggeredBy().value(),
                saved.getTransactionsToProcess(), saved.getRetryOf() != null ? ", retryOf=" + saved.getRetryOf() : "");
        applicationEventPublisher.publishEvent(new PrecisionSearchQueuedEvent(saved.getId(), saved.getUserId()));
        return Optional.of(saved);
    }
}
