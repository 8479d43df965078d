package com.myorg.olc.invoice.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.connection.ConnectionPusher;
import com.myorg.olc.invoice.ImportTransactionExpiryHandler;
import com.myorg.olc.invoice.InvoiceImportService;
import com.myorg.olc.invoice.InvoiceRepository;
import com.myorg.olc.invoice.UploadNotificationRouter;
import com.myorg.olc.invoice.audit.AuditBus;
import com.myorg.olc.invoice.audit.KafkaAuditBus;
import com.myorg.olc.invoice.audit.LoggingAuditBus;
import com.myorg.olc.invoice.blob.BlobStore;
import com.myorg.olc.invoice.blob.InMemoryBlobStore;
import com.myorg.olc.invoice.parse.InvoiceParser;
import com.myorg.olc.invoice.parse.JsonInvoiceParser;
import com.myorg.olc.invoice.route.CancelImportRoute;
import com.myorg.olc.invoice.route.GetImportUrlRoute;
import com.myorg.olc.ledger.store.LedgerStore;
import com.myorg.olc.ledger.transaction.TransactionLedger;
import com.myorg.olc.queue.QueueRegistry;
import com.myorg.olc.queue.consumer.QueueHandlerBinding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;

@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration",
        "com.myorg.olc.kafka.OlcKafkaProducerAutoConfiguration",
        "com.myorg.olc.ledger.autoconfig.OlcLedgerAutoConfiguration",
        "com.myorg.olc.queue.autoconfig.OlcQueueAutoConfiguration",
        "com.myorg.olc.connection.autoconfig.OlcConnectionAutoConfiguration"
})
@EnableConfigurationProperties(OlcInvoiceProperties.class)
@ConditionalOnProperty(prefix = "olc.invoice", name = "enabled", havingValue = "true", matchIfMissing = true)
@ConditionalOnBean({TransactionLedger.class, ConnectionPusher.class})
public class OlcInvoiceAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public BlobStore blobStore(OlcInvoiceProperties props, ObjectProvider<Clock> clock) {
        return new InMemoryBlobStore(clock.getIfAvailable(Clock::systemUTC), props.getUploadBaseUrl());
    }

    @Bean
    @ConditionalOnMissingBean
    public InvoiceParser invoiceParser(ObjectProvider<ObjectMapper> mapper) {
        return new JsonInvoiceParser(mapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public InvoiceRepository invoiceRepository(LedgerStore store, ObjectProvider<ObjectMapper> mapper) {
        return new InvoiceRepository(store, mapper.getIfAvailable(ObjectMapper::new));
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(KafkaTemplate.class)
    @ConditionalOnExpression("'${olc.invoice.audit.topic:}'.length() > 0")
    static class KafkaAuditConfig {

        @Bean
        @ConditionalOnMissingBean(AuditBus.class)
        @ConditionalOnBean(KafkaTemplate.class)
        public AuditBus kafkaAuditBus(KafkaTemplate<String, Object> template, OlcInvoiceProperties props) {
            log.info("Audit events go to topic {}", props.getAudit().getTopic());
            return new KafkaAuditBus(template, props.getAudit().getTopic());
        }
    }

    @Bean
    @ConditionalOnMissingBean(AuditBus.class)
    public AuditBus loggingAuditBus() {
        return new LoggingAuditBus();
    }

    @Bean
    @ConditionalOnMissingBean
    public InvoiceImportService invoiceImportService(TransactionLedger transactions,
                                                     InvoiceRepository invoices,
                                                     BlobStore blobs,
                                                     InvoiceParser parser,
                                                     AuditBus audit,
                                                     ConnectionPusher pusher,
                                                     OlcInvoiceProperties props,
                                                     ObjectProvider<Clock> clock) {
        return new InvoiceImportService(transactions, invoices, blobs, parser, audit, pusher, props,
                clock.getIfAvailable(Clock::systemUTC));
    }

    @Bean
    @ConditionalOnMissingBean
    public UploadNotificationRouter uploadNotificationRouter(InvoiceImportService imports,
                                                             BlobStore blobs,
                                                             ObjectProvider<QueueRegistry> queues,
                                                             OlcInvoiceProperties props,
                                                             ObjectProvider<ObjectMapper> mapper) {
        UploadNotificationRouter router = new UploadNotificationRouter(imports, queues.getIfAvailable(),
                props.getUploadQueue(), mapper.getIfAvailable(ObjectMapper::new));
        blobs.addUploadListener(router);
        log.info("Upload notifications {}", router.isQueued() ? "queued on " + props.getUploadQueue() : "handled inline");
        return router;
    }

    @Bean
    @ConditionalOnExpression("'${olc.invoice.upload-queue:invoice-uploads}'.length() > 0")
    public QueueHandlerBinding invoiceUploadBinding(UploadNotificationRouter router, OlcInvoiceProperties props) {
        return new QueueHandlerBinding(props.getUploadQueue(), router.queueHandler());
    }

    @Bean
    @ConditionalOnMissingBean
    public ImportTransactionExpiryHandler importTransactionExpiryHandler(TransactionLedger transactions,
                                                                         InvoiceImportService imports) {
        return new ImportTransactionExpiryHandler(transactions, imports);
    }

    @Bean
    public GetImportUrlRoute getImportUrlRoute(InvoiceImportService imports) {
        return new GetImportUrlRoute(imports);
    }

    @Bean
    public CancelImportRoute cancelImportRoute(InvoiceImportService imports) {
        return new CancelImportRoute(imports);
    }
}
