package com.myorg.olc.invoice.autoconfig;

import com.myorg.olc.connection.autoconfig.OlcConnectionAutoConfiguration;
import com.myorg.olc.connection.route.ChannelRouter;
import com.myorg.olc.invoice.ImportTransactionExpiryHandler;
import com.myorg.olc.invoice.InvoiceImportService;
import com.myorg.olc.invoice.UploadNotificationRouter;
import com.myorg.olc.invoice.audit.AuditBus;
import com.myorg.olc.invoice.audit.LoggingAuditBus;
import com.myorg.olc.ledger.autoconfig.OlcLedgerAutoConfiguration;
import com.myorg.olc.ledger.expiry.LedgerExpirySweeper;
import com.myorg.olc.queue.autoconfig.OlcQueueAutoConfiguration;
import com.myorg.olc.queue.consumer.QueueHandlerBinding;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class OlcInvoiceAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    OlcLedgerAutoConfiguration.class,
                    OlcQueueAutoConfiguration.class,
                    OlcConnectionAutoConfiguration.class,
                    OlcInvoiceAutoConfiguration.class))
            .withPropertyValues(
                    "olc.ledger.store=memory",
                    "olc.ledger.sweeper.scheduling-enabled=false",
                    "olc.queue.consumer.scheduling-enabled=false");

    @Test
    void wiresImportFlowWithQueuedUploads() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(InvoiceImportService.class);
            assertThat(ctx).hasSingleBean(ImportTransactionExpiryHandler.class);
            assertThat(ctx.getBean(AuditBus.class)).isInstanceOf(LoggingAuditBus.class);
            assertThat(ctx.getBean(ChannelRouter.class).actions()).contains("getImportUrl", "cancelImport");
            assertThat(ctx.getBean(UploadNotificationRouter.class).isQueued()).isTrue();
            assertThat(ctx.getBean(QueueHandlerBinding.class).queue()).isEqualTo("invoice-uploads");
            assertThat(ctx).hasSingleBean(LedgerExpirySweeper.class);
        });
    }

    @Test
    void blankUploadQueueImportsInline() {
        runner.withPropertyValues("olc.invoice.upload-queue=")
                .run(ctx -> {
                    assertThat(ctx.getBean(UploadNotificationRouter.class).isQueued()).isFalse();
                    assertThat(ctx).doesNotHaveBean(QueueHandlerBinding.class);
                });
    }

    @Test
    void canBeDisabled() {
        runner.withPropertyValues("olc.invoice.enabled=false")
                .run(ctx -> assertThat(ctx).doesNotHaveBean(InvoiceImportService.class));
    }
}
