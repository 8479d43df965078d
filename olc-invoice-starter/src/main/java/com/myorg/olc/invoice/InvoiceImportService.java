package com.myorg.olc.invoice;

import com.myorg.olc.connection.ConnectionPusher;
import com.myorg.olc.connection.PushResult;
import com.myorg.olc.contracts.audit.AuditEvent;
import com.myorg.olc.contracts.core.exception.OlcNonRetryableException;
import com.myorg.olc.contracts.core.exception.PoisonMessageException;
import com.myorg.olc.contracts.core.exception.ValidationException;
import com.myorg.olc.contracts.invoice.ImportState;
import com.myorg.olc.contracts.invoice.ImportStatusMessage;
import com.myorg.olc.contracts.invoice.ImportTransaction;
import com.myorg.olc.contracts.invoice.InvoiceRecord;
import com.myorg.olc.invoice.audit.AuditBus;
import com.myorg.olc.invoice.autoconfig.OlcInvoiceProperties;
import com.myorg.olc.invoice.blob.BlobStore;
import com.myorg.olc.invoice.blob.UploadTarget;
import com.myorg.olc.invoice.parse.InvoiceParseException;
import com.myorg.olc.invoice.parse.InvoiceParser;
import com.myorg.olc.ledger.store.WriteOutcome;
import com.myorg.olc.ledger.transaction.TransactionLedger;
import com.myorg.olc.ledger.transaction.TransitionOutcome;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Drives an invoice import through STARTED, URL_ISSUED, PROCESSING and one of the terminal states.
 * <p>
 * Nothing is kept between calls: every step reads the transaction from the ledger and moves it
 * with a conditional transition, so duplicate notifications and racing cancellations resolve in
 * the store. Cancellation is logical. Invoices already written when a cancel lands stay written.
 */
@Slf4j
public class InvoiceImportService {

    public static final String AUDIT_INVOICE = "Invoice";
    public static final String AUDIT_IMPORT_TIMEOUT = "ImportTimeout";

    private static final Set<ImportState> RUNNABLE = EnumSet.of(ImportState.URL_ISSUED, ImportState.PROCESSING);

    private final TransactionLedger transactions;
    private final InvoiceRepository invoices;
    private final BlobStore blobs;
    private final InvoiceParser parser;
    private final AuditBus audit;
    private final ConnectionPusher pusher;
    private final OlcInvoiceProperties props;
    private final Clock clock;

    public InvoiceImportService(TransactionLedger transactions,
                                InvoiceRepository invoices,
                                BlobStore blobs,
                                InvoiceParser parser,
                                AuditBus audit,
                                ConnectionPusher pusher,
                                OlcInvoiceProperties props,
                                Clock clock) {
        this.transactions = transactions;
        this.invoices = invoices;
        this.blobs = blobs;
        this.parser = parser;
        this.audit = audit;
        this.pusher = pusher;
        this.props = props;
        this.clock = clock;
    }

    public ImportStatusMessage requestImport(String connectionId) {
        return requestImport(connectionId, UUID.randomUUID().toString());
    }

    /**
     * Opens a transaction and pushes an upload URL to {@code connectionId}. A transaction id that
     * was used before is refused with an {@code ERROR} status.
     */
    public ImportStatusMessage requestImport(String connectionId, String transactionId) {
        if (connectionId == null || connectionId.isBlank()) {
            throw new ValidationException("connectionId is required");
        }
        if (transactionId == null || transactionId.isBlank() || transactionId.contains("/")) {
            throw new ValidationException("invalid transactionId '" + transactionId + "'");
        }

        String objectKey = objectKey(transactionId);
        ImportTransaction tx = ImportTransaction.builder()
                .transactionId(transactionId)
                .connectionId(connectionId)
                .state(ImportState.STARTED)
                .resourceKey(objectKey)
                .createdAtMs(clock.millis())
                .expiresAtEpochSec(clock.instant().plus(props.getTransactionTtl()).getEpochSecond())
                .build();

        if (transactions.begin(tx) == WriteOutcome.ALREADY_EXISTS) {
            log.warn("Import refused, transaction exists transactionId={} connectionId={}", transactionId, connectionId);
            return notify(connectionId, status(transactionId, ImportStatusMessage.ERROR)
                    .detail("transaction " + transactionId + " already exists").build());
        }

        UploadTarget target = blobs.createUploadTarget(objectKey, props.getUploadUrlTtl());

        TransitionOutcome issued = transactions.transition(transactionId, Set.of(ImportState.STARTED), ImportState.URL_ISSUED);
        if (!issued.isApplied()) {
            // only a cancel or an expiry can get in between
            return notify(connectionId, currentStatus(transactionId, issued));
        }

        log.info("Import URL issued transactionId={} connectionId={} expiresAt={}",
                transactionId, connectionId, target.expiresAt());
        return notify(connectionId, status(transactionId, ImportState.URL_ISSUED.name())
                .url(target.url())
                .expiresAtEpochSec(target.expiresAt().getEpochSecond())
                .build());
    }

    /**
     * Imports an uploaded file. A notification that finds the transaction in PROCESSING resumes a
     * run that failed part way; invoices are write-once, so rows the earlier run wrote are found
     * again and nothing is written twice. A terminal transaction is left alone.
     *
     * @return state of the transaction when this call finished, empty for an unknown transaction
     * @throws InvoiceParseException if the file cannot be imported; the transaction is FAILED and the blob kept
     * @throws ImportAbandonedException when the last allowed run fails; the transaction is FAILED
     */
    public Optional<ImportState> onUploadCompleted(String objectKey) {
        String transactionId = transactionIdOf(objectKey);

        TransitionOutcome started = transactions.transition(
                transactionId, RUNNABLE, ImportState.PROCESSING,
                t -> t.toBuilder().attempts(t.getAttempts() + 1).build());
        if (started.status() == TransitionOutcome.Status.NOT_FOUND) {
            log.warn("Upload for unknown transaction ignored key={}", objectKey);
            return Optional.empty();
        }
        if (!started.isApplied()) {
            log.info("Upload notification ignored transactionId={} state={}",
                    transactionId, started.current().getState());
            return Optional.of(started.current().getState());
        }
        ImportTransaction tx = started.current();
        if (tx.getAttempts() > 1) {
            log.info("Import resumed transactionId={} attempt={}", transactionId, tx.getAttempts());
        }

        try {
            return process(tx, objectKey);
        } catch (InvoiceParseException e) {
            throw fail(tx, e.getMessage(), e);
        } catch (OlcNonRetryableException e) {
            throw e;
        } catch (RuntimeException e) {
            if (tx.getAttempts() < props.getMaxProcessingAttempts()) {
                log.warn("Import run failed, left in PROCESSING transactionId={} attempt={} error={}",
                        transactionId, tx.getAttempts(), e.toString());
                throw e;
            }
            String detail = "import gave up after " + tx.getAttempts() + " attempts: " + e.getMessage();
            throw fail(tx, detail, new ImportAbandonedException(detail, e));
        }
    }

    /** Processing runs a transaction gets before it is FAILED. */
    public int maxProcessingAttempts() {
        return Math.max(1, props.getMaxProcessingAttempts());
    }

    private Optional<ImportState> process(ImportTransaction tx, String objectKey) {
        String transactionId = tx.getTransactionId();
        byte[] content = blobs.get(objectKey).orElse(null);
        if (content == null) {
            throw new InvoiceParseException("uploaded object " + objectKey + " is missing");
        }
        List<InvoiceRecord> records = parser.parse(content);

        int processed = 0;
        int duplicates = 0;
        for (InvoiceRecord record : records) {
            ImportState now = transactions.find(transactionId).map(ImportTransaction::getState).orElse(null);
            if (now != ImportState.PROCESSING) {
                log.info("Import stopped transactionId={} state={} processed={}", transactionId, now, processed);
                return Optional.ofNullable(now);
            }

            if (invoices.insert(record, transactionId) == WriteOutcome.ALREADY_EXISTS) {
                boolean ours = invoices.importedBy(record.getCustomerName(), record.getInvoiceNumber())
                        .filter(transactionId::equals)
                        .isPresent();
                if (!ours) {
                    duplicates++;
                    log.debug("Invoice already imported customer={} invoiceNumber={}",
                            record.getCustomerName(), record.getInvoiceNumber());
                    continue;
                }
                // written by an earlier run of this transaction, audited then
                processed++;
            } else {
                processed++;
                audit.publish(invoiceAudit(record, transactionId));
            }
            notify(tx.getConnectionId(), status(transactionId, ImportStatusMessage.PROGRESS)
                    .detail(record.getInvoiceNumber())
                    .processed(processed)
                    .duplicates(duplicates)
                    .build());
        }

        final int p = processed;
        final int d = duplicates;
        TransitionOutcome done = transactions.transition(transactionId, Set.of(ImportState.PROCESSING), ImportState.COMPLETED,
                t -> t.toBuilder().processed(p).duplicates(d).build());
        if (!done.isApplied()) {
            log.info("Import finished after transaction left PROCESSING transactionId={} state={}",
                    transactionId, done.current() == null ? null : done.current().getState());
            return Optional.ofNullable(done.current()).map(ImportTransaction::getState);
        }

        blobs.delete(objectKey);
        log.info("Import completed transactionId={} processed={} duplicates={}", transactionId, p, d);
        notify(tx.getConnectionId(), status(transactionId, ImportState.COMPLETED.name())
                .processed(p)
                .duplicates(d)
                .build());
        return Optional.of(ImportState.COMPLETED);
    }

    /**
     * Cancels an import that has not finished yet. Otherwise the client is told the state the
     * transaction is already in.
     */
    public Optional<ImportState> cancel(String connectionId, String transactionId) {
        if (connectionId == null || connectionId.isBlank()) {
            throw new ValidationException("connectionId is required");
        }
        Optional<ImportTransaction> found = transactionId == null || transactionId.isBlank()
                ? Optional.empty()
                : transactions.find(transactionId);
        if (found.isEmpty()) {
            notify(connectionId, status(transactionId, ImportStatusMessage.ERROR)
                    .detail("unknown transaction " + transactionId).build());
            return Optional.empty();
        }
        if (!connectionId.equals(found.get().getConnectionId())) {
            log.warn("Cancel refused, not the owner transactionId={} connectionId={}", transactionId, connectionId);
            notify(connectionId, status(transactionId, ImportStatusMessage.ERROR)
                    .detail("unknown transaction " + transactionId).build());
            return Optional.empty();
        }

        TransitionOutcome out = transactions.transition(transactionId, ImportState.CANCELLABLE, ImportState.CANCELLED);
        switch (out.status()) {
            case APPLIED -> {
                log.info("Import cancelled transactionId={}", transactionId);
                notify(connectionId, status(transactionId, ImportState.CANCELLED.name()).build());
                return Optional.of(ImportState.CANCELLED);
            }
            case REJECTED -> {
                notify(connectionId, currentStatus(transactionId, out));
                return Optional.of(out.current().getState());
            }
            default -> {
                notify(connectionId, status(transactionId, ImportStatusMessage.ERROR)
                        .detail("unknown transaction " + transactionId).build());
                return Optional.empty();
            }
        }
    }

    /** Reports a transaction that expired before reaching a terminal state. */
    public void onTransactionExpired(ImportTransaction tx) {
        if (tx.getState() == null || tx.getState().isTerminal()) return;

        log.warn("Import timed out transactionId={} state={}", tx.getTransactionId(), tx.getState());
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("transactionId", tx.getTransactionId());
        detail.put("connectionId", tx.getConnectionId());
        detail.put("state", tx.getState().name());
        audit.publish(auditEvent(AUDIT_IMPORT_TIMEOUT, detail));

        if (tx.getResourceKey() != null) blobs.delete(tx.getResourceKey());
        notify(tx.getConnectionId(), status(tx.getTransactionId(), ImportStatusMessage.TIMEOUT)
                .detail("import expired in state " + tx.getState()).build());
    }

    public String objectKey(String transactionId) {
        return props.getKeyPrefix() + transactionId;
    }

    String transactionIdOf(String objectKey) {
        String prefix = props.getKeyPrefix();
        if (objectKey == null || !objectKey.startsWith(prefix) || objectKey.length() == prefix.length()) {
            throw new PoisonMessageException("object key '" + objectKey + "' is not an import upload");
        }
        return objectKey.substring(prefix.length());
    }

    // the original failure is returned for the caller to throw; a store still failing is attached to it
    private <E extends RuntimeException> E fail(ImportTransaction tx, String detail, E cause) {
        TransitionOutcome failed;
        try {
            failed = transactions.transition(tx.getTransactionId(), Set.of(ImportState.PROCESSING), ImportState.FAILED);
        } catch (RuntimeException e) {
            log.error("Could not mark import FAILED, expiry will report it transactionId={}", tx.getTransactionId(), e);
            cause.addSuppressed(e);
            return cause;
        }
        if (failed.isApplied()) {
            log.warn("Import failed transactionId={} key={} error={}", tx.getTransactionId(), tx.getResourceKey(), detail);
            notify(tx.getConnectionId(), status(tx.getTransactionId(), ImportState.FAILED.name())
                    .detail(detail).build());
        }
        return cause;
    }

    private ImportStatusMessage currentStatus(String transactionId, TransitionOutcome out) {
        if (out.current() == null) {
            return status(transactionId, ImportStatusMessage.ERROR).detail("unknown transaction " + transactionId).build();
        }
        ImportState state = out.current().getState();
        return status(transactionId, state.name()).detail("transaction is " + state).build();
    }

    // pushes are best effort: the transaction state is the source of truth
    private ImportStatusMessage notify(String connectionId, ImportStatusMessage msg) {
        try {
            if (pusher.pushJson(connectionId, msg) == PushResult.GONE) {
                log.debug("Client gone, status not delivered connectionId={} status={}", connectionId, msg.getStatus());
            }
        } catch (RuntimeException e) {
            log.warn("Status push failed connectionId={} status={} error={}", connectionId, msg.getStatus(), e.toString());
        }
        return msg;
    }

    private AuditEvent invoiceAudit(InvoiceRecord r, String transactionId) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("transactionId", transactionId);
        detail.put("invoiceNumber", r.getInvoiceNumber());
        detail.put("customerName", r.getCustomerName());
        detail.put("totalValue", r.getTotalValue());
        detail.put("productId", r.getProductId());
        detail.put("quantity", r.getQuantity());
        return auditEvent(AUDIT_INVOICE, detail);
    }

    private AuditEvent auditEvent(String detailType, Map<String, Object> detail) {
        return AuditEvent.builder()
                .source(props.getAudit().getSource())
                .detailType(detailType)
                .detail(detail)
                .occurredAtMs(clock.millis())
                .build();
    }

    private static ImportStatusMessage.ImportStatusMessageBuilder status(String transactionId, String status) {
        return ImportStatusMessage.builder().transactionId(transactionId).status(status);
    }
}
