package com.taxstudio.search.dispatch;

import com.taxstudio.config.AsyncConfig;
import com.taxstudio.domain.MailSyncCompletedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Queues an all_incomplete precision search when a mail sync completes having created files.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MailSyncCompletionListener {

    private final PrecisionSearchDispatcher dispatcher;

    @EventListener
    @Async(AsyncConfig.EVENT_EXECUTOR)
    public void onMailSyncCompleted(MailSyncCompletedEvent event) {
        if (!event.isCompletionEdge()) {
            log.debug("Mail sync {} status {} -> {}: not a completion, ignoring",
                    event.mailSyncJobId(), event.previousStatus(), event.status());
            return;
        }
        if (event.filesCreated() <= 0) {
            log.debug("Mail sync {} completed without new files, ignoring", event.mailSyncJobId());
            return;
        }
        try {
            dispatcher.triggerFromMailSync(event.userId(), event.mailSyncJobId())
                    .ifPresent(queueId -> log.info("Mail sync {} ({} files) queued precision search {} for user {}",
                            event.mailSyncJobId(), event.filesCreated(), queueId, event.userId()));
        } catch (RuntimeException e) {
            log.error("Mail sync {}: failed to queue precision search for user {}",
                    event.mailSyncJobId(), event.userId(), e);
        }
    }
}
