package com.myorg.olc.invoice;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.olc.contracts.invoice.InvoiceRecord;
import com.myorg.olc.ledger.store.LedgerEntry;
import com.myorg.olc.ledger.store.LedgerKeys;
import com.myorg.olc.ledger.store.LedgerStore;
import com.myorg.olc.ledger.store.WriteOutcome;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Imported invoices, one write-once row per (customer, invoice number).
 */
@RequiredArgsConstructor
public class InvoiceRepository {

    public static final String NAMESPACE = "invoice";

    static final String TRANSACTION_FIELD = "transactionId";

    private final LedgerStore store;
    private final ObjectMapper mapper;

    /** A replayed import finds its rows already present and gets {@link WriteOutcome#ALREADY_EXISTS}. */
    public WriteOutcome insert(InvoiceRecord invoice, String transactionId) {
        ObjectNode payload = mapper.valueToTree(invoice);
        payload.put(TRANSACTION_FIELD, transactionId);
        LedgerEntry entry = new LedgerEntry(
                partitionKey(invoice.getCustomerName()), invoice.getInvoiceNumber(), null, payload, null);
        return store.putIfAbsent(NAMESPACE, entry);
    }

    public Optional<InvoiceRecord> find(String customerName, String invoiceNumber) {
        return store.get(partitionKey(customerName), invoiceNumber).map(e -> {
            ObjectNode p = e.payload().deepCopy();
            p.remove(TRANSACTION_FIELD);
            try {
                return mapper.treeToValue(p, InvoiceRecord.class);
            } catch (JsonProcessingException ex) {
                throw new IllegalStateException("Corrupt invoice row " + e.partitionKey() + "/" + e.sortKey(), ex);
            }
        });
    }

    /** Transaction that wrote the row, empty when there is no row. */
    public Optional<String> importedBy(String customerName, String invoiceNumber) {
        return store.get(partitionKey(customerName), invoiceNumber)
                .map(e -> e.payload().path(TRANSACTION_FIELD).asText(null));
    }

    public static String partitionKey(String customerName) {
        return LedgerKeys.key(NAMESPACE, customerName);
    }
}
