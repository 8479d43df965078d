package com.myorg.olc.invoice;

import com.myorg.olc.contracts.core.exception.TransientStoreException;
import com.myorg.olc.ledger.store.LedgerEntry;
import com.myorg.olc.ledger.store.LedgerPage;
import com.myorg.olc.ledger.store.LedgerStore;
import com.myorg.olc.ledger.store.UpdateResult;
import com.myorg.olc.ledger.store.WriteOutcome;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/** Delegating store whose write-once inserts can be made to fail a number of times. */
class FlakyLedgerStore implements LedgerStore {

    private final LedgerStore delegate;
    private Predicate<LedgerEntry> failWhen = e -> false;
    private int failuresLeft;

    FlakyLedgerStore(LedgerStore delegate) {
        this.delegate = delegate;
    }

    void failPutIfAbsent(Predicate<LedgerEntry> when, int times) {
        this.failWhen = when;
        this.failuresLeft = times;
    }

    @Override
    public WriteOutcome putIfAbsent(String namespace, LedgerEntry entry) {
        if (failuresLeft > 0 && failWhen.test(entry)) {
            failuresLeft--;
            throw new TransientStoreException("store unavailable writing " + entry.partitionKey());
        }
        return delegate.putIfAbsent(namespace, entry);
    }

    @Override
    public void put(LedgerEntry entry) {
        delegate.put(entry);
    }

    @Override
    public Optional<LedgerEntry> get(String partitionKey, String sortKey) {
        return delegate.get(partitionKey, sortKey);
    }

    @Override
    public UpdateResult update(String namespace, String partitionKey, String sortKey,
                               Predicate<LedgerEntry> condition, UnaryOperator<LedgerEntry> mutation) {
        return delegate.update(namespace, partitionKey, sortKey, condition, mutation);
    }

    @Override
    public void delete(String partitionKey, String sortKey) {
        delegate.delete(partitionKey, sortKey);
    }

    @Override
    public LedgerPage queryByIndex(String indexKey, String sortKeyPrefix, String exclusiveStartKey, int limit) {
        return delegate.queryByIndex(indexKey, sortKeyPrefix, exclusiveStartKey, limit);
    }

    @Override
    public List<LedgerEntry> purgeExpired(Instant now) {
        return delegate.purgeExpired(now);
    }
}
