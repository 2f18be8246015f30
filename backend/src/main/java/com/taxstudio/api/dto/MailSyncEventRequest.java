package com.taxstudio.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/precision-search/mail-sync-events body, sent by the mail sync job on status changes.
 * Statuses are case-insensitive ({@code completed}).
 */
public record MailSyncEventRequest(
        @NotBlank(message = "MAIL_SYNC_JOB_ID_REQUIRED") String mailSyncJobId,
        @NotBlank(message = "USER_ID_REQUIRED") String userId,
        String previousStatus,
        @NotBlank(message = "STATUS_REQUIRED") String status,
        @Min(value = 0, message = "INVALID_FILES_CREATED") int filesCreated
) {
}
