package com.taxstudio.search.dispatch;

import com.taxstudio.domain.MailSyncCompletedEvent;
import com.taxstudio.domain.MailSyncStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MailSyncCompletionListenerTest {

    @Mock
    private PrecisionSearchDispatcher dispatcher;

    @InjectMocks
    private MailSyncCompletionListener listener;

    @Test
    @DisplayName("transition into COMPLETED with new files queues a search")
    void completionWithFilesTriggers() {
        when(dispatcher.triggerFromMailSync("u1", "ms-1")).thenReturn(Optional.of("q1"));

        listener.onMailSyncCompleted(new MailSyncCompletedEvent("ms-1", "u1",
                MailSyncStatus.PROCESSING, MailSyncStatus.COMPLETED, 3));

        verify(dispatcher).triggerFromMailSync("u1", "ms-1");
    }

    @Test
    @DisplayName("completion without new files does nothing")
    void completionWithoutFilesIgnored() {
        listener.onMailSyncCompleted(new MailSyncCompletedEvent("ms-1", "u1",
                MailSyncStatus.PROCESSING, MailSyncStatus.COMPLETED, 0));

        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("non-completion transitions and repeated COMPLETED updates do nothing")
    void nonCompletionEdgesIgnored() {
        listener.onMailSyncCompleted(new MailSyncCompletedEvent("ms-1", "u1",
                MailSyncStatus.PENDING, MailSyncStatus.PROCESSING, 5));
        listener.onMailSyncCompleted(new MailSyncCompletedEvent("ms-1", "u1",
                MailSyncStatus.COMPLETED, MailSyncStatus.COMPLETED, 5));
        listener.onMailSyncCompleted(new MailSyncCompletedEvent("ms-1", "u1",
                MailSyncStatus.PROCESSING, MailSyncStatus.FAILED, 5));

        verifyNoInteractions(dispatcher);
    }

    @Test
    void dispatcherFailureIsContained() {
        when(dispatcher.triggerFromMailSync("u1", "ms-1"))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        assertThatCode(() -> listener.onMailSyncCompleted(new MailSyncCompletedEvent("ms-1", "u1",
                MailSyncStatus.PROCESSING, MailSyncStatus.COMPLETED, 2))).doesNotThrowAnyException();
    }
}
