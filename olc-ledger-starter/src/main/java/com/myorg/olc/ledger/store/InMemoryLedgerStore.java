package com.myorg.olc.ledger.store;

import com.myorg.olc.contracts.core.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

// Single-instance store for dev and tests. Per-key atomicity comes from ConcurrentHashMap.compute.
@Slf4j
public class InMemoryLedgerStore implements LedgerStore {

    private record Key(String pk, String sk) {}

    private final ConcurrentHashMap<Key, LedgerEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, NavigableSet<String>> index = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryLedgerStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public WriteOutcome putIfAbsent(String namespace, LedgerEntry entry) {
        LedgerKeys.requireInNamespace(namespace, entry.partitionKey());
        Instant now = clock.instant();
        WriteOutcome[] out = new WriteOutcome[1];

        entries.compute(key(entry), (k, cur) -> {
            if (cur != null && !cur.isExpiredAt(now)) {
                out[0] = WriteOutcome.ALREADY_EXISTS;
                return cur;
            }
            if (cur != null) unindex(cur);
            index(entry);
            out[0] = WriteOutcome.WRITTEN;
            return entry;
        });
        return out[0];
    }

    @Override
    public void put(LedgerEntry entry) {
        entries.compute(key(entry), (k, cur) -> {
            if (cur != null) unindex(cur);
            index(entry);
            return entry;
        });
    }

    @Override
    public Optional<LedgerEntry> get(String partitionKey, String sortKey) {
        LedgerEntry e = entries.get(new Key(partitionKey, sortKey));
        if (e == null || e.isExpiredAt(clock.instant())) return Optional.empty();
        return Optional.of(e);
    }

    @Override
    public UpdateResult update(String namespace,
                               String partitionKey,
                               String sortKey,
                               Predicate<LedgerEntry> condition,
                               UnaryOperator<LedgerEntry> mutation) {
        LedgerKeys.requireInNamespace(namespace, partitionKey);
        Instant now = clock.instant();
        UpdateResult[] out = new UpdateResult[1];

        entries.computeIfPresent(new Key(partitionKey, sortKey), (k, cur) -> {
            if (cur.isExpiredAt(now)) {
                out[0] = UpdateResult.notFound();
                return cur;
            }
            if (!condition.test(cur)) {
                out[0] = UpdateResult.conditionFailed(cur);
                return cur;
            }
            LedgerEntry next = mutation.apply(cur);
            if (!cur.partitionKey().equals(next.partitionKey()) || !cur.sortKey().equals(next.sortKey())) {
                throw new ValidationException("update must not change the primary key");
            }
            unindex(cur);
            index(next);
            out[0] = UpdateResult.applied(next);
            return next;
        });
        return out[0] == null ? UpdateResult.notFound() : out[0];
    }

    @Override
    public void delete(String partitionKey, String sortKey) {
        entries.computeIfPresent(new Key(partitionKey, sortKey), (k, cur) -> {
            unindex(cur);
            return null;
        });
    }

    @Override
    public LedgerPage queryByIndex(String indexKey, String sortKeyPrefix, String exclusiveStartKey, int limit) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive");
        NavigableSet<String> members = index.get(indexKey);
        if (members == null) return new LedgerPage(List.of(), null);

        String prefix = sortKeyPrefix == null ? "" : sortKeyPrefix;
        NavigableSet<String> tail = exclusiveStartKey != null
                ? members.tailSet(exclusiveStartKey, false)
                : members.tailSet(prefix, true);

        Instant now = clock.instant();
        List<LedgerEntry> items = new ArrayList<>();
        String last = null;
        for (String member : tail) {
            String[] parts = LedgerKeys.splitIndexMember(member);
            if (!parts[0].startsWith(prefix)) break;

            LedgerEntry e = entries.get(new Key(parts[1], parts[0]));
            if (e == null || e.isExpiredAt(now) || !indexKey.equals(e.indexKey())) continue;

            if (items.size() == limit) {
                // one more match exists beyond this page
                return new LedgerPage(items, last);
            }
            items.add(e);
            last = member;
        }
        return new LedgerPage(items, null);
    }

    @Override
    public List<LedgerEntry> purgeExpired(Instant now) {
        List<LedgerEntry> purged = new ArrayList<>();
        Iterator<Map.Entry<Key, LedgerEntry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Key, LedgerEntry> e = it.next();
            LedgerEntry v = e.getValue();
            if (v.isExpiredAt(now) && entries.remove(e.getKey(), v)) {
                unindex(v);
                purged.add(v);
            }
        }
        if (!purged.isEmpty()) {
            log.debug("Purged {} expired ledger entries", purged.size());
        }
        return purged;
    }

    public int size() {
        return entries.size();
    }

    private void index(LedgerEntry e) {
        if (e.indexKey() == null) return;
        index.computeIfAbsent(e.indexKey(), k -> new ConcurrentSkipListSet<>()).add(LedgerKeys.indexMember(e));
    }

    private void unindex(LedgerEntry e) {
        if (e.indexKey() == null) return;
        NavigableSet<String> set = index.get(e.indexKey());
        if (set != null) set.remove(LedgerKeys.indexMember(e));
    }

    private static Key key(LedgerEntry e) {
        return new Key(e.partitionKey(), e.sortKey());
    }
}
