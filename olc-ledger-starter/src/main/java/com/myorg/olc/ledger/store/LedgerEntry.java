package com.myorg.olc.ledger.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.olc.contracts.core.exception.ValidationException;

import java.time.Instant;
import java.util.Objects;

/**
 * One row of the ledger. {@code ttl} is in epoch seconds; an entry whose ttl has passed is
 * logically absent even when it has not been physically removed yet.
 */
public record LedgerEntry(
        String partitionKey,
        String sortKey,
        String indexKey,
        JsonNode payload,
        Long ttl
) {
    public LedgerEntry {
        Objects.requireNonNull(partitionKey, "partitionKey");
        Objects.requireNonNull(sortKey, "sortKey");
        // NUL separates the parts of an index member
        if (partitionKey.indexOf('\u0000') >= 0 || sortKey.indexOf('\u0000') >= 0) {
            throw new ValidationException("ledger keys must not contain NUL");
        }
    }

    public static LedgerEntry of(String partitionKey, String sortKey, JsonNode payload) {
        return new LedgerEntry(partitionKey, sortKey, null, payload, null);
    }

    public boolean isExpiredAt(Instant now) {
        return ttl != null && now.getEpochSecond() >= ttl;
    }

    public LedgerEntry withPayload(JsonNode newPayload) {
        return new LedgerEntry(partitionKey, sortKey, indexKey, newPayload, ttl);
    }
}
