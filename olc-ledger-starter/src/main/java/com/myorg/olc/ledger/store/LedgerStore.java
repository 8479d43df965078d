package com.myorg.olc.ledger.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Durable key-value store shared by every ledger. Conditional operations are the only
 * coordination primitive: callers never assume in-process mutual exclusion.
 */
public interface LedgerStore {

    /**
     * Write-once insert. Exactly one of any number of concurrent inserts of the same
     * (partitionKey, sortKey) returns {@link WriteOutcome#WRITTEN}.
     *
     * @param namespace namespace token the partition key must start with
     * @throws com.myorg.olc.contracts.core.exception.ValidationException if the key is outside the namespace
     */
    WriteOutcome putIfAbsent(String namespace, LedgerEntry entry);

    /** Unconditional upsert. */
    void put(LedgerEntry entry);

    Optional<LedgerEntry> get(String partitionKey, String sortKey);

    /**
     * Optimistic update: {@code mutation} is applied only if the current row satisfies
     * {@code condition} at write time.
     */
    UpdateResult update(String namespace,
                        String partitionKey,
                        String sortKey,
                        Predicate<LedgerEntry> condition,
                        UnaryOperator<LedgerEntry> mutation);

    /** Deleting an absent row is not an error. */
    void delete(String partitionKey, String sortKey);

    /**
     * Secondary-index query ordered by sort key.
     *
     * @param sortKeyPrefix only entries whose sort key starts with this (null = all)
     * @param exclusiveStartKey cursor from a previous {@link LedgerPage}, or null
     */
    LedgerPage queryByIndex(String indexKey, String sortKeyPrefix, String exclusiveStartKey, int limit);

    /**
     * Physically removes entries whose ttl has passed and returns their last image,
     * in the manner of a change stream REMOVE record.
     */
    List<LedgerEntry> purgeExpired(Instant now);
}
