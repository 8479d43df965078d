package com.myorg.olc.ledger.order;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.contracts.order.OrderEvent;
import com.myorg.olc.contracts.order.OrderEventType;
import com.myorg.olc.ledger.store.LedgerEntry;
import com.myorg.olc.ledger.store.LedgerKeys;
import com.myorg.olc.ledger.store.LedgerStore;
import com.myorg.olc.ledger.store.PagedLedgerIterable;
import com.myorg.olc.ledger.store.WriteOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Append-only history of order events. Rows live under {@code order#<orderId>} with sort key
 * {@code <eventType>#<timestamp>} and are indexed by requester email.
 */
@Slf4j
@RequiredArgsConstructor
public class OrderEventLedger {

    public static final String NAMESPACE = "order";

    private final LedgerStore store;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Duration entryTtl; // null = keep forever
    private final int pageSize;

    public WriteOutcome append(OrderEvent event) {
        event.validate();
        LedgerEntry entry = new LedgerEntry(
                partitionKey(event.getOrderId()),
                sortKey(event.getEventType(), event.getTimestamp()),
                normalizeEmail(event.getRequesterEmail()),
                mapper.valueToTree(event),
                entryTtl == null ? null : clock.instant().plus(entryTtl).getEpochSecond()
        );

        WriteOutcome outcome = store.putIfAbsent(NAMESPACE, entry);
        if (outcome == WriteOutcome.ALREADY_EXISTS) {
            log.debug("Order event already recorded pk={} sk={}", entry.partitionKey(), entry.sortKey());
        }
        return outcome;
    }

    /**
     * Events raised by a requester, ordered by sort key. Restartable: each iteration re-runs the query.
     *
     * @param eventType optional filter, null for all types
     */
    public Iterable<LedgerEntry> queryByRequester(String email, OrderEventType eventType) {
        String indexKey = normalizeEmail(email);
        String prefix = eventType == null ? null : eventType.name() + LedgerKeys.SEPARATOR;
        return new PagedLedgerIterable(cursor -> store.queryByIndex(indexKey, prefix, cursor, pageSize));
    }

    public OrderEvent toEvent(LedgerEntry entry) {
        try {
            return mapper.treeToValue(entry.payload(), OrderEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Ledger entry is not an order event: " + entry.partitionKey(), e);
        }
    }

    public static String partitionKey(String orderId) {
        return LedgerKeys.key(NAMESPACE, orderId);
    }

    // zero-padded so lexical order equals chronological order within a type
    public static String sortKey(OrderEventType type, long timestamp) {
        return type.name() + LedgerKeys.SEPARATOR + String.format("%013d", timestamp);
    }

    private static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
