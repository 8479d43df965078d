package com.myorg.olc.ledger.transaction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.contracts.invoice.ImportState;
import com.myorg.olc.contracts.invoice.ImportTransaction;
import com.myorg.olc.ledger.store.InMemoryLedgerStore;
import com.myorg.olc.ledger.store.WriteOutcome;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TransactionLedgerTest {

    private final TransactionLedger ledger =
            new TransactionLedger(new InMemoryLedgerStore(Clock.systemUTC()), new ObjectMapper());

    @Test
    void beginIsWriteOnce() {
        assertThat(ledger.begin(tx("t1"))).isEqualTo(WriteOutcome.WRITTEN);
        assertThat(ledger.begin(tx("t1"))).isEqualTo(WriteOutcome.ALREADY_EXISTS);
        assertThat(ledger.find("t1")).get().extracting(ImportTransaction::getState).isEqualTo(ImportState.STARTED);
    }

    @Test
    void transitionIsGuardedByStoredState() {
        ledger.begin(tx("t1"));

        TransitionOutcome wrongFrom = ledger.transition("t1", Set.of(ImportState.URL_ISSUED), ImportState.PROCESSING);
        assertThat(wrongFrom.status()).isEqualTo(TransitionOutcome.Status.REJECTED);
        assertThat(wrongFrom.current().getState()).isEqualTo(ImportState.STARTED);

        TransitionOutcome ok = ledger.transition("t1", Set.of(ImportState.STARTED), ImportState.URL_ISSUED,
                t -> t.toBuilder().resourceKey("invoices/t1").build());
        assertThat(ok.isApplied()).isTrue();
        assertThat(ok.current().getResourceKey()).isEqualTo("invoices/t1");
        assertThat(ledger.find("t1")).get().extracting(ImportTransaction::getState).isEqualTo(ImportState.URL_ISSUED);
    }

    @Test
    void terminalStatesNeverMove() {
        ledger.begin(tx("t1"));
        ledger.transition("t1", Set.of(ImportState.STARTED), ImportState.CANCELLED);

        TransitionOutcome again = ledger.transition("t1", Set.of(ImportState.CANCELLED), ImportState.PROCESSING);

        assertThat(again.status()).isEqualTo(TransitionOutcome.Status.REJECTED);
        assertThat(ledger.find("t1")).get().extracting(ImportTransaction::getState).isEqualTo(ImportState.CANCELLED);
    }

    @Test
    void unknownTransactionIsNotFound() {
        assertThat(ledger.transition("nope", Set.of(ImportState.URL_ISSUED), ImportState.CANCELLED).status())
                .isEqualTo(TransitionOutcome.Status.NOT_FOUND);
    }

    @Test
    void updateInKeepsStateAndChangesCounters() {
        ledger.begin(tx("t1"));

        TransitionOutcome out = ledger.updateIn("t1", ImportState.STARTED, t -> t.toBuilder().processed(3).build());

        assertThat(out.isApplied()).isTrue();
        assertThat(out.current().getState()).isEqualTo(ImportState.STARTED);
        assertThat(out.current().getProcessed()).isEqualTo(3);
    }

    private static ImportTransaction tx(String id) {
        return ImportTransaction.builder()
                .transactionId(id)
                .connectionId("c1")
                .state(ImportState.STARTED)
                .createdAtMs(1L)
                .build();
    }
}
