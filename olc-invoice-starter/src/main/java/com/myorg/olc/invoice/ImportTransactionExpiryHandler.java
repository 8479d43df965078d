package com.myorg.olc.invoice;

import com.myorg.olc.ledger.expiry.LedgerExpiryListener;
import com.myorg.olc.ledger.store.LedgerEntry;
import com.myorg.olc.ledger.transaction.TransactionLedger;
import lombok.RequiredArgsConstructor;

/**
 * Turns expired import transaction rows into timeout notifications.
 */
@RequiredArgsConstructor
public class ImportTransactionExpiryHandler implements LedgerExpiryListener {

    private final TransactionLedger transactions;
    private final InvoiceImportService imports;

    @Override
    public void onExpired(LedgerEntry oldImage) {
        if (!TransactionLedger.isTransactionEntry(oldImage)) return;
        imports.onTransactionExpired(transactions.toTransaction(oldImage));
    }
}
