package com.taxstudio.domain;

/**
 * Application event: a mail-account sync job changed status. Only the transition into COMPLETED with
 * {@code filesCreated > 0} triggers a precision search.
 */
public record MailSyncCompletedEvent(String mailSyncJobId, String userId, MailSyncStatus previousStatus,
                                     MailSyncStatus status, int filesCreated) {

    public boolean isCompletionEdge() {
        return status == MailSyncStatus.COMPLETED && previousStatus != MailSyncStatus.COMPLETED;
    }
}
