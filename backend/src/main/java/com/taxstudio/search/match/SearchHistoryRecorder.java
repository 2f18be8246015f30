package com.taxstudio.search.match;

import com.taxstudio.domain.PrecisionSearchQueueItem;
import com.taxstudio.domain.SearchAttempt;
import com.taxstudio.domain.TransactionSearchEntry;
import com.taxstudio.domain.TransactionSearchEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Per-transaction search log: one {@link TransactionSearchEntry} per (transaction, queue item), one
 * {@link SearchAttempt} appended per strategy run. Audit only; a failed write is logged and does not stop
 * the search.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SearchHistoryRecorder {

    private final TransactionSearchEntryRepository entryRepository;

    public void record(PrecisionSearchQueueItem item, String transactionId, SearchAttempt attempt) {
        try {
            TransactionSearchEntry entry = entryRepository
                    .findByTransactionIdAndQueueId(transactionId, item.getId())
                    .orElseGet(() -> newEntry(item, transactionId));
            if (!entry.getStrategiesAttempted().contains(attempt.strategyId())) {
                entry.getStrategiesAttempted().add(attempt.strategyId());
            }
            entry.getAttempts().add(attempt);
            if (!attempt.fileIdsConnected().isEmpty()) {
                entry.setAutomationSource(attempt.strategyId());
                entry.setTotalFilesConnected(entry.getTotalFilesConnected() + attempt.fileIdsConnected().size());
            }
            entry.setUpdatedAt(Instant.now());
            entryRepository.save(entry);
        } catch (DataAccessException e) {
            log.warn("Could not record search attempt {} for transaction {} in queue {}: {}",
                    attempt.strategyId(), transactionId, item.getId(), e.getMessage());
        }
    }

    public List<TransactionSearchEntry> latest(String transactionId, String userId, int limit) {
        return entryRepository.findByTransactionIdAndUserIdOrderByCreatedAtDesc(
                transactionId, userId, PageRequest.of(0, limit));
    }

    private static TransactionSearchEntry newEntry(PrecisionSearchQueueItem item, String transactionId) {
        TransactionSearchEntry entry = new TransactionSearchEntry();
        entry.setTransactionId(transactionId);
        entry.setQueueId(item.getId());
        entry.setUserId(item.getUserId());
        entry.setTriggeredBy(item.getTriggeredBy());
        entry.setCreatedAt(Instant.now());
        return entry;
    }
}
