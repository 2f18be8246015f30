package com.taxstudio.search.job;

import com.taxstudio.domain.PrecisionSearchQueueItem;
import com.taxstudio.domain.PrecisionSearchQueueRepository;
import com.taxstudio.domain.SearchStatus;
import com.taxstudio.search.dispatch.PrecisionSearchDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Re-enqueues FAILED items whose backoff has elapsed, once per failed item ({@code retryOf} link), while
 * {@code retryCount < maxRetries}. A user with another item in flight is retried on a later tick.
 * Once a retry is queued, or the item turns out not to need one, its {@code nextRetryAfter} is cleared.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PrecisionSearchRetryScheduler {

    static final int RETRY_BATCH_SIZE = 50;

    private final PrecisionSearchQueueRepository queueRepository;
    private final PrecisionSearchDispatcher dispatcher;

    @Scheduled(fixedDelayString = "${taxstudio.precision-search.retry-scheduler-interval-ms:120000}")
    public void retryFailed() {
        List<PrecisionSearchQueueItem> due = queueRepository
                .findByStatusAndNextRetryAfterLessThanEqualOrderByNextRetryAfterAsc(
                        SearchStatus.FAILED, Instant.now(), PageRequest.of(0, RETRY_BATCH_SIZE));
        for (PrecisionSearchQueueItem failed : due) {
            try {
                if (!failed.isRetryable() || queueRepository.existsByRetryOf(failed.getId())) {
                    queueRepository.clearRetryMarker(failed.getId());
                    continue;
                }
                Optional<String> queued = dispatcher.enqueueRetry(failed);
                if (queued.isPresent()) {
                    log.info("Retrying precision search {} as {} (retry {}/{})",
                            failed.getId(), queued.get(), failed.getRetryCount(), failed.getMaxRetries());
                    queueRepository.clearRetryMarker(failed.getId());
                }
            } catch (DataAccessException e) {
                log.warn("Retry of precision search {} not queued: {}", failed.getId(), e.getMessage());
            }
        }
    }
}
