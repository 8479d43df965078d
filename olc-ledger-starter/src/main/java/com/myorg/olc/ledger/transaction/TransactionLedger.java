package com.myorg.olc.ledger.transaction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.contracts.core.exception.ValidationException;
import com.myorg.olc.contracts.invoice.ImportState;
import com.myorg.olc.contracts.invoice.ImportTransaction;
import com.myorg.olc.ledger.store.LedgerEntry;
import com.myorg.olc.ledger.store.LedgerKeys;
import com.myorg.olc.ledger.store.LedgerStore;
import com.myorg.olc.ledger.store.UpdateResult;
import com.myorg.olc.ledger.store.WriteOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Durable state of import transactions. Every transition is re-validated against the stored
 * state at write time, so two racing callers cannot both move the same transaction.
 */
@Slf4j
@RequiredArgsConstructor
public class TransactionLedger {

    public static final String NAMESPACE = "transaction";
    static final String SORT_KEY = "state";

    private final LedgerStore store;
    private final ObjectMapper mapper;

    /** Write-once: replaying the same transaction id yields {@link WriteOutcome#ALREADY_EXISTS}. */
    public WriteOutcome begin(ImportTransaction tx) {
        if (tx.getState() == null || tx.getState().isTerminal()) {
            throw new ValidationException("a transaction must begin in a non-terminal state");
        }
        LedgerEntry entry = new LedgerEntry(
                partitionKey(tx.getTransactionId()), SORT_KEY, null, mapper.valueToTree(tx), tx.getExpiresAtEpochSec());
        return store.putIfAbsent(NAMESPACE, entry);
    }

    public Optional<ImportTransaction> find(String transactionId) {
        return store.get(partitionKey(transactionId), SORT_KEY).map(this::toTransaction);
    }

    public TransitionOutcome transition(String transactionId, Set<ImportState> allowedFrom, ImportState to) {
        return transition(transactionId, allowedFrom, to, UnaryOperator.identity());
    }

    /**
     * Moves to {@code to} only if the stored state is in {@code allowedFrom}, applying {@code change}
     * to the other fields in the same write. Terminal states never move.
     */
    public TransitionOutcome transition(String transactionId,
                                        Set<ImportState> allowedFrom,
                                        ImportState to,
                                        UnaryOperator<ImportTransaction> change) {
        UpdateResult res = store.update(
                NAMESPACE,
                partitionKey(transactionId),
                SORT_KEY,
                e -> {
                    ImportState cur = toTransaction(e).getState();
                    return !cur.isTerminal() && allowedFrom.contains(cur);
                },
                e -> e.withPayload(mapper.valueToTree(change.apply(toTransaction(e)).toBuilder().state(to).build()))
        );
        TransitionOutcome out = toOutcome(res);
        if (out.isApplied()) {
            log.info("Import transaction {} -> {}", transactionId, to);
        } else {
            log.debug("Import transaction {} not moved to {}: {}", transactionId, to, out.status());
        }
        return out;
    }

    /** Updates non-state fields while the transaction is still in {@code expected}. */
    public TransitionOutcome updateIn(String transactionId, ImportState expected, UnaryOperator<ImportTransaction> change) {
        return transition(transactionId, Set.of(expected), expected, change);
    }

    public static String partitionKey(String transactionId) {
        return LedgerKeys.key(NAMESPACE, transactionId);
    }

    public static boolean isTransactionEntry(LedgerEntry e) {
        return LedgerKeys.inNamespace(NAMESPACE, e.partitionKey()) && SORT_KEY.equals(e.sortKey());
    }

    public ImportTransaction toTransaction(LedgerEntry e) {
        try {
            return mapper.treeToValue(e.payload(), ImportTransaction.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Corrupt transaction row " + e.partitionKey(), ex);
        }
    }

    private TransitionOutcome toOutcome(UpdateResult res) {
        return switch (res.status()) {
            case APPLIED -> new TransitionOutcome(TransitionOutcome.Status.APPLIED, toTransaction(res.entry()));
            case CONDITION_FAILED -> new TransitionOutcome(TransitionOutcome.Status.REJECTED, toTransaction(res.entry()));
            case NOT_FOUND -> new TransitionOutcome(TransitionOutcome.Status.NOT_FOUND, null);
        };
    }
}
