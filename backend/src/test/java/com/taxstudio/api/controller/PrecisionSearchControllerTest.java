package com.taxstudio.api.controller;

import com.taxstudio.domain.MailSyncCompletedEvent;
import com.taxstudio.domain.MailSyncStatus;
import com.taxstudio.domain.PrecisionSearchQueueItem;
import com.taxstudio.domain.SearchScope;
import com.taxstudio.domain.SearchStatus;
import com.taxstudio.domain.SearchTrigger;
import com.taxstudio.domain.TransactionSearchEntry;
import com.taxstudio.search.dispatch.InvalidTriggerException;
import com.taxstudio.search.dispatch.PrecisionSearchDispatcher;
import com.taxstudio.search.match.SearchHistoryRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PrecisionSearchControllerTest {

    private static final String BASE = "/api/v1/precision-search";

    @Mock
    private PrecisionSearchDispatcher dispatcher;
    @Mock
    private SearchHistoryRecorder historyRecorder;
    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        PrecisionSearchController controller = new PrecisionSearchController(
                dispatcher, historyRecorder, applicationEventPublisher);
        webTestClient = WebTestClient.bindToController(controller)
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("POST /trigger returns the queue id")
    void trigger() {
        when(dispatcher.trigger("u1", "all_incomplete", null)).thenReturn("q1");

        webTestClient.post().uri(BASE + "/trigger")
                .header(PrecisionSearchController.USER_HEADER, "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"scope\":\"all_incomplete\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.queueId").isEqualTo("q1");
    }

    @Test
    @DisplayName("POST /trigger with an invalid scope returns 400 INVALID_TRIGGER")
    void triggerInvalidScope() {
        when(dispatcher.trigger("u1", "everything", null))
                .thenThrow(new InvalidTriggerException("Invalid scope 'everything'"));

        webTestClient.post().uri(BASE + "/trigger")
                .header(PrecisionSearchController.USER_HEADER, "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"scope\":\"everything\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_TRIGGER")
                .jsonPath("$.message").isEqualTo("Invalid scope 'everything'");
    }

    @Test
    @DisplayName("POST /trigger surfaces store failures as 500")
    void triggerStoreFailure() {
        when(dispatcher.trigger("u1", "single_transaction", "t1"))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        webTestClient.post().uri(BASE + "/trigger")
                .header(PrecisionSearchController.USER_HEADER, "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"scope\":\"single_transaction\",\"transactionId\":\"t1\"}")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.error").isEqualTo("STORE_UNAVAILABLE");
    }

    @Test
    @DisplayName("GET /status returns progress of the caller's item")
    void status() {
        PrecisionSearchQueueItem item = new PrecisionSearchQueueItem();
        item.setId("q1");
        item.setUserId("u1");
        item.setScope(SearchScope.ALL_INCOMPLETE);
        item.setStatus(SearchStatus.PROCESSING);
        item.setTriggeredBy(SearchTrigger.MAIL_SYNC);
        item.setStrategies(new ArrayList<>(List.of("partner_files", "amount_files")));
        item.setCurrentStrategyIndex(1);
        item.setTransactionsToProcess(4);
        item.setTransactionsProcessed(2);
        when(dispatcher.findForUser("q1", "u1")).thenReturn(Optional.of(item));

        webTestClient.get().uri(BASE + "/status/q1")
                .header(PrecisionSearchController.USER_HEADER, "u1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.queueId").isEqualTo("q1")
                .jsonPath("$.status").isEqualTo("processing")
                .jsonPath("$.scope").isEqualTo("all_incomplete")
                .jsonPath("$.triggeredBy").isEqualTo("mail_sync")
                .jsonPath("$.progressPct").isEqualTo(50)
                .jsonPath("$.currentStrategy").isEqualTo("amount_files");
    }

    @Test
    @DisplayName("GET /status of another user's item is 404")
    void statusOtherUser() {
        when(dispatcher.findForUser("q1", "u1")).thenReturn(Optional.empty());

        webTestClient.get().uri(BASE + "/status/q1")
                .header(PrecisionSearchController.USER_HEADER, "u1")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("NOT_FOUND");
    }

    @Test
    void statusWithoutUserHeader() {
        webTestClient.get().uri(BASE + "/status/q1")
                .exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("POST /mail-sync-events publishes the status change and returns 202")
    void mailSyncEvent() {
        webTestClient.post().uri(BASE + "/mail-sync-events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"mailSyncJobId\":\"ms-1\",\"userId\":\"u1\",\"previousStatus\":\"processing\","
                        + "\"status\":\"completed\",\"filesCreated\":3}")
                .exchange()
                .expectStatus().isAccepted();

        verify(applicationEventPublisher).publishEvent(new MailSyncCompletedEvent(
                "ms-1", "u1", MailSyncStatus.PROCESSING, MailSyncStatus.COMPLETED, 3));
    }

    @Test
    void mailSyncEventUnknownStatus() {
        webTestClient.post().uri(BASE + "/mail-sync-events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"mailSyncJobId\":\"ms-1\",\"userId\":\"u1\",\"status\":\"done\",\"filesCreated\":3}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_TRIGGER");

        verify(applicationEventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("POST /mail-sync-events without userId fails validation")
    void mailSyncEventValidation() {
        webTestClient.post().uri(BASE + "/mail-sync-events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"mailSyncJobId\":\"ms-1\",\"status\":\"completed\",\"filesCreated\":3}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("USER_ID_REQUIRED");
    }

    @Test
    @DisplayName("GET /transactions/{id}/history lists the latest runs")
    void history() {
        TransactionSearchEntry entry = new TransactionSearchEntry();
        entry.setQueueId("q1");
        entry.setTransactionId("t1");
        entry.setTriggeredBy(SearchTrigger.MANUAL);
        entry.getStrategiesAttempted().add("partner_files");
        entry.setAutomationSource("partner_files");
        entry.setTotalFilesConnected(1);
        when(historyRecorder.latest("t1", "u1", 10)).thenReturn(List.of(entry));

        webTestClient.get().uri(BASE + "/transactions/t1/history")
                .header(PrecisionSearchController.USER_HEADER, "u1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].queueId").isEqualTo("q1")
                .jsonPath("$[0].triggeredBy").isEqualTo("manual")
                .jsonPath("$[0].automationSource").isEqualTo("partner_files")
                .jsonPath("$[0].totalFilesConnected").isEqualTo(1);
    }
}
