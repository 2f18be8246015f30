package com.taxstudio.api.controller;

import com.taxstudio.api.dto.ErrorBody;
import com.taxstudio.api.dto.MailSyncEventRequest;
import com.taxstudio.api.dto.QueueItemStatusResponse;
import com.taxstudio.api.dto.SearchHistoryItemResponse;
import com.taxstudio.api.dto.TriggerSearchRequest;
import com.taxstudio.api.dto.TriggerSearchResponse;
import com.taxstudio.domain.MailSyncCompletedEvent;
import com.taxstudio.domain.MailSyncStatus;
import com.taxstudio.search.dispatch.InvalidTriggerException;
import com.taxstudio.search.dispatch.PrecisionSearchDispatcher;
import com.taxstudio.search.match.SearchHistoryRecorder;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Precision search API. The caller is identified by the {@code X-User-Id} header.
 * <ul>
 *   <li>POST /trigger: queue a search (or get the one in flight)</li>
 *   <li>POST /mail-sync-events: mail sync status notifications</li>
 *   <li>GET /status/{queueId}: progress of one queue item</li>
 *   <li>GET /transactions/{transactionId}/history: latest search runs over a transaction</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/precision-search")
@RequiredArgsConstructor
public class PrecisionSearchController {

    static final String USER_HEADER = "X-User-Id";
    private static final int HISTORY_LIMIT = 10;

    private final PrecisionSearchDispatcher dispatcher;
    private final SearchHistoryRecorder historyRecorder;
    private final ApplicationEventPublisher applicationEventPublisher;

    @PostMapping("/trigger")
    public ResponseEntity<TriggerSearchResponse> trigger(
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @RequestBody TriggerSearchRequest request) {
        String queueId = dispatcher.trigger(userId, request.scope(), request.transactionId());
        return ResponseEntity.ok(new TriggerSearchResponse(true, queueId));
    }

    @PostMapping("/mail-sync-events")
    public ResponseEntity<Void> mailSyncEvent(@Valid @RequestBody MailSyncEventRequest request) {
        MailSyncStatus status = MailSyncStatus.fromValue(request.status())
                .orElseThrow(() -> new InvalidTriggerException("Unknown mail sync status: " + request.status()));
        MailSyncStatus previous = request.previousStatus() == null ? null
                : MailSyncStatus.fromValue(request.previousStatus()).orElseThrow(() ->
                        new InvalidTriggerException("Unknown mail sync status: " + request.previousStatus()));
        applicationEventPublisher.publishEvent(new MailSyncCompletedEvent(
                request.mailSyncJobId(), request.userId(), previous, status, request.filesCreated()));
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/status/{queueId}")
    public ResponseEntity<?> status(
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @PathVariable String queueId) {
        requireUser(userId);
        return dispatcher.findForUser(queueId, userId)
                .<ResponseEntity<?>>map(item -> ResponseEntity.ok(QueueItemStatusResponse.from(item)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorBody.of("NOT_FOUND", "Precision search not found: " + queueId)));
    }

    @GetMapping("/transactions/{transactionId}/history")
    public ResponseEntity<List<SearchHistoryItemResponse>> history(
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @PathVariable String transactionId) {
        requireUser(userId);
        List<SearchHistoryItemResponse> items = historyRecorder.latest(transactionId, userId, HISTORY_LIMIT).stream()
                .map(SearchHistoryItemResponse::from)
                .toList();
        return ResponseEntity.ok(items);
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidTriggerException(USER_HEADER + " header is required");
        }
    }
}
