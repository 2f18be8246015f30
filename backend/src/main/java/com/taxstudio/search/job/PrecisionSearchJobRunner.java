package com.taxstudio.search.job;

import com.taxstudio.config.AsyncConfig;
import com.taxstudio.domain.PrecisionSearchQueueItem;
import com.taxstudio.domain.PrecisionSearchQueueRepository;
import com.taxstudio.domain.PrecisionSearchQueuedEvent;
import com.taxstudio.domain.SearchStatus;
import com.taxstudio.search.config.PrecisionSearchProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Feeds queue items to {@link PrecisionSearchExecutor} on the search-executor pool: on PrecisionSearchQueuedEvent,
 * and from scheduled sweeps for PENDING items whose event was lost and PROCESSING items whose lease expired.
 * Also deletes terminal items past retention.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PrecisionSearchJobRunner {

    private final PrecisionSearchExecutor executor;
    private final PrecisionSearchQueueRepository queueRepository;
    private final PrecisionSearchProperties properties;
    @Qualifier(AsyncConfig.SEARCH_EXECUTOR)
    private final Executor searchExecutor;

    @EventListener
    @Async(AsyncConfig.SEARCH_EXECUTOR)
    public void onQueued(PrecisionSearchQueuedEvent event) {
        executor.claimAndRun(event.queueId());
    }

    @Scheduled(fixedDelayString = "${taxstudio.precision-search.poll-interval-ms:30000}",
            initialDelayString = "${taxstudio.precision-search.poll-interval-ms:30000}")
    public void pollPending() {
        List<PrecisionSearchQueueItem> pending = queueRepository.findByStatusOrderByCreatedAtAsc(
                SearchStatus.PENDING, PageRequest.of(0, Math.max(1, properties.getPollBatchSize())));
        if (pending.isEmpty()) {
            return;
        }
        log.info("Picking up {} pending precision search item(s)", pending.size());
        for (PrecisionSearchQueueItem item : pending) {
            String queueId = item.getId();
            searchExecutor.execute(() -> executor.claimAndRun(queueId));
        }
    }

    @Scheduled(fixedDelayString = "${taxstudio.precision-search.stale-sweep-interval-ms:60000}",
            initialDelayString = "${taxstudio.precision-search.stale-sweep-interval-ms:60000}")
    public void sweepStale() {
        List<String> stale = queueRepository.findStaleProcessingIds(
                Instant.now(), Math.max(1, properties.getPollBatchSize()));
        if (stale.isEmpty()) {
            return;
        }
        log.info("Found {} precision search item(s) with expired lease", stale.size());
        for (String queueId : stale) {
            searchExecutor.execute(() -> executor.resumeStale(queueId));
        }
    }

    /** Deletes COMPLETED/FAILED items older than the retention window. Runs every hour. */
    @Scheduled(fixedRate = 3600_000)
    public void deleteExpiredItems() {
        Instant cutoff = Instant.now().minus(Duration.ofDays(properties.getRetentionDays()));
        queueRepository.deleteByStatusInAndCompletedAtBefore(SearchStatus.TERMINAL, cutoff);
    }
}
