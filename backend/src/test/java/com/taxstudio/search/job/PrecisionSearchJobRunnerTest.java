package com.taxstudio.search.job;

import com.taxstudio.domain.PrecisionSearchQueueItem;
import com.taxstudio.domain.PrecisionSearchQueueRepository;
import com.taxstudio.domain.PrecisionSearchQueuedEvent;
import com.taxstudio.domain.SearchStatus;
import com.taxstudio.search.config.PrecisionSearchProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PrecisionSearchJobRunnerTest {

    @Mock
    private PrecisionSearchExecutor executor;
    @Mock
    private PrecisionSearchQueueRepository queueRepository;

    private PrecisionSearchJobRunner runner;

    @BeforeEach
    void setUp() {
        runner = new PrecisionSearchJobRunner(executor, queueRepository, new PrecisionSearchProperties(), Runnable::run);
    }

    @Test
    void queuedEventClaimsItem() {
        runner.onQueued(new PrecisionSearchQueuedEvent("q1", "u1"));

        verify(executor).claimAndRun("q1");
    }

    @Test
    @DisplayName("poll picks up pending items whose queued event was missed, oldest first")
    void pollPending() {
        PrecisionSearchQueueItem a = pending("q-a");
        PrecisionSearchQueueItem b = pending("q-b");
        when(queueRepository.findByStatusOrderByCreatedAtAsc(SearchStatus.PENDING, PageRequest.of(0, 20)))
                .thenReturn(List.of(a, b));

        runner.pollPending();

        verify(executor).claimAndRun("q-a");
        verify(executor).claimAndRun("q-b");
    }

    @Test
    @DisplayName("stale sweep resumes items with an expired lease")
    void sweepStale() {
        when(queueRepository.findStaleProcessingIds(any(), anyInt())).thenReturn(List.of("q-stale"));

        runner.sweepStale();

        verify(executor).resumeStale("q-stale");
    }

    @Test
    void emptySweepsDoNothing() {
        when(queueRepository.findStaleProcessingIds(any(), anyInt())).thenReturn(List.of());
        when(queueRepository.findByStatusOrderByCreatedAtAsc(eq(SearchStatus.PENDING), any())).thenReturn(List.of());

        runner.sweepStale();
        runner.pollPending();

        verifyNoInteractions(executor);
    }

    @Test
    @DisplayName("retention cleanup removes terminal items older than 7 days")
    void retentionCleanup() {
        Instant before = Instant.now();

        runner.deleteExpiredItems();

        ArgumentCaptor<Instant> cutoff = ArgumentCaptor.forClass(Instant.class);
        verify(queueRepository).deleteByStatusInAndCompletedAtBefore(eq(SearchStatus.TERMINAL), cutoff.capture());
        assertThat(cutoff.getValue()).isBetween(before.minus(Duration.ofDays(7)).minusSeconds(1),
                Instant.now().minus(Duration.ofDays(7)));
    }

    private static PrecisionSearchQueueItem pending(String id) {
        PrecisionSearchQueueItem item = new PrecisionSearchQueueItem();
        item.setId(id);
        item.setStatus(SearchStatus.PENDING);
        return item;
    }
}
