package com.myorg.olc.invoice;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.contracts.core.exception.PoisonMessageException;
import com.myorg.olc.contracts.core.exception.TransientStoreException;
import com.myorg.olc.contracts.invoice.ImportState;
import com.myorg.olc.queue.DurableQueue;
import com.myorg.olc.queue.InMemoryQueueRegistry;
import com.myorg.olc.queue.QueueMessage;
import com.myorg.olc.queue.autoconfig.OlcQueueProperties;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class UploadNotificationRouterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final InvoiceImportService imports = mock(InvoiceImportService.class);

    @Test
    void inlineModeCallsTheImportDirectly() {
        UploadNotificationRouter router = new UploadNotificationRouter(imports, null, "", mapper);

        router.onUploadCompleted("invoices/tx-1");

        assertThat(router.isQueued()).isFalse();
        verify(imports).onUploadCompleted("invoices/tx-1");
    }

    @Test
    void inlineModeRetriesTransientFailuresUpToTheImportBound() {
        when(imports.maxProcessingAttempts()).thenReturn(3);
        when(imports.onUploadCompleted("invoices/tx-1"))
                .thenThrow(new TransientStoreException("down"))
                .thenReturn(Optional.of(ImportState.COMPLETED));
        UploadNotificationRouter router = new UploadNotificationRouter(imports, null, null, mapper);

        router.onUploadCompleted("invoices/tx-1");

        verify(imports, times(2)).onUploadCompleted("invoices/tx-1");
    }

    @Test
    void inlineModeGivesUpAfterTheBound() {
        when(imports.maxProcessingAttempts()).thenReturn(3);
        when(imports.onUploadCompleted("invoices/tx-1")).thenThrow(new TransientStoreException("down"));
        UploadNotificationRouter router = new UploadNotificationRouter(imports, null, null, mapper);

        assertThatThrownBy(() -> router.onUploadCompleted("invoices/tx-1"))
                .isInstanceOf(TransientStoreException.class);
        verify(imports, times(3)).onUploadCompleted("invoices/tx-1");
    }

    @Test
    void inlineModeDoesNotRetryNonRetryableFailures() {
        when(imports.maxProcessingAttempts()).thenReturn(3);
        when(imports.onUploadCompleted("invoices/tx-1")).thenThrow(new PoisonMessageException("bad file"));
        UploadNotificationRouter router = new UploadNotificationRouter(imports, null, null, mapper);

        assertThatThrownBy(() -> router.onUploadCompleted("invoices/tx-1"))
                .isInstanceOf(PoisonMessageException.class);
        verify(imports).onUploadCompleted("invoices/tx-1");
    }

    @Test
    void queuedModeEnqueuesAndHandlerImports() throws Exception {
        InMemoryQueueRegistry queues = new InMemoryQueueRegistry(new OlcQueueProperties(), Clock.systemUTC());
        UploadNotificationRouter router = new UploadNotificationRouter(imports, queues, "invoice-uploads", mapper);

        router.onUploadCompleted("invoices/tx-1");

        verifyNoInteractions(imports);
        DurableQueue q = queues.queue("invoice-uploads");
        List<QueueMessage> batch = q.receiveBatch(10);
        assertThat(batch).hasSize(1);
        assertThat(batch.get(0).attributes()).containsEntry("objectKey", "invoices/tx-1");

        router.queueHandler().handle(batch.get(0));
        verify(imports).onUploadCompleted("invoices/tx-1");
    }

    @Test
    void malformedNotificationIsPoison() {
        UploadNotificationRouter router = new UploadNotificationRouter(imports, null, null, mapper);

        assertThatThrownBy(() -> router.objectKeyOf("nope")).isInstanceOf(PoisonMessageException.class);
        assertThatThrownBy(() -> router.objectKeyOf("{\"key\":\"x\"}")).isInstanceOf(PoisonMessageException.class);
    }

    @Test
    void queueWithoutRegistryFailsFast() {
        assertThatThrownBy(() -> new UploadNotificationRouter(imports, null, "invoice-uploads", mapper))
                .isInstanceOf(IllegalStateException.class);
    }
}
