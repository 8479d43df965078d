package com.myorg.olc.ledger.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.contracts.core.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryLedgerStoreTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_000);

    private final ObjectMapper mapper = new ObjectMapper();
    private final InMemoryLedgerStore store = new InMemoryLedgerStore(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void writeOnceInsertSucceedsExactlyOnce() {
        LedgerEntry e = entry("order#o1", "ORDER_CREATED#1", null, null);

        assertThat(store.putIfAbsent("order", e)).isEqualTo(WriteOutcome.WRITTEN);
        assertThat(store.putIfAbsent("order", e)).isEqualTo(WriteOutcome.ALREADY_EXISTS);
    }

    @Test
    void concurrentInsertsYieldOneWinner() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<WriteOutcome>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                LedgerEntry e = entry("order#race", "ORDER_CREATED#1", null, null);
                Callable<WriteOutcome> c = () -> {
                    start.await();
                    return store.putIfAbsent("order", e);
                };
                results.add(pool.submit(c));
            }
            start.countDown();

            int written = 0;
            for (Future<WriteOutcome> f : results) {
                if (f.get() == WriteOutcome.WRITTEN) written++;
            }
            assertThat(written).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void conditionalWriteOutsideNamespaceIsRejected() {
        LedgerEntry e = entry("invoice#acme", "INV-1", null, null);

        assertThatThrownBy(() -> store.putIfAbsent("order", e))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("outside namespace");
        assertThat(store.size()).isZero();
    }

    @Test
    void namespaceTokenMustMatchWholeSegment() {
        LedgerEntry e = entry("orders#o1", "x", null, null);

        assertThatThrownBy(() -> store.putIfAbsent("order", e)).isInstanceOf(ValidationException.class);
    }

    @Test
    void expiredEntryIsLogicallyAbsentAndCanBeRewritten() {
        store.put(entry("order#old", "s", null, 999L));

        assertThat(store.get("order#old", "s")).isEmpty();
        assertThat(store.putIfAbsent("order", entry("order#old", "s", null, 5_000L)))
                .isEqualTo(WriteOutcome.WRITTEN);
        assertThat(store.get("order#old", "s")).isPresent();
    }

    @Test
    void updateAppliesOnlyWhenConditionHolds() {
        store.put(entry("transaction#t1", "state", null, null));

        UpdateResult miss = store.update("transaction", "transaction#t1", "state",
                e -> false, e -> e.withPayload(mapper.createObjectNode().put("v", 2)));
        assertThat(miss.status()).isEqualTo(UpdateResult.Status.CONDITION_FAILED);

        UpdateResult hit = store.update("transaction", "transaction#t1", "state",
                e -> true, e -> e.withPayload(mapper.createObjectNode().put("v", 2)));
        assertThat(hit.isApplied()).isTrue();
        assertThat(store.get("transaction#t1", "state")).get()
                .extracting(e -> e.payload().get("v").asInt()).isEqualTo(2);

        assertThat(store.update("transaction", "transaction#none", "state", e -> true, e -> e).status())
                .isEqualTo(UpdateResult.Status.NOT_FOUND);
    }

    @Test
    void deleteIsIdempotent() {
        store.put(entry("connection#c1", "connection", null, null));
        store.delete("connection#c1", "connection");
        store.delete("connection#c1", "connection");

        assertThat(store.get("connection#c1", "connection")).isEmpty();
    }

    @Test
    void indexQueryIsOrderedFilteredAndPaged() {
        store.put(entry("order#o2", "ORDER_DELETED#0000000000003", "a@x.io", null));
        store.put(entry("order#o1", "ORDER_CREATED#0000000000002", "a@x.io", null));
        store.put(entry("order#o3", "ORDER_CREATED#0000000000001", "a@x.io", null));
        store.put(entry("order#o4", "ORDER_CREATED#0000000000004", "b@x.io", null));

        LedgerPage first = store.queryByIndex("a@x.io", "ORDER_CREATED#", null, 1);
        assertThat(first.items()).extracting(LedgerEntry::partitionKey).containsExactly("order#o3");
        assertThat(first.hasMore()).isTrue();

        LedgerPage second = store.queryByIndex("a@x.io", "ORDER_CREATED#", first.lastEvaluatedKey(), 1);
        assertThat(second.items()).extracting(LedgerEntry::partitionKey).containsExactly("order#o1");
        assertThat(second.hasMore()).isFalse();

        LedgerPage all = store.queryByIndex("a@x.io", null, null, 10);
        assertThat(all.items()).extracting(LedgerEntry::partitionKey).containsExactly("order#o3", "order#o1", "order#o2");
    }

    @Test
    void purgeReturnsOldImagesOfExpiredEntries() {
        store.put(entry("transaction#t1", "state", null, 2_000L));
        store.put(entry("transaction#t2", "state", null, 9_000L));
        store.put(entry("order#o1", "ORDER_CREATED#1", null, null));

        List<LedgerEntry> purged = store.purgeExpired(Instant.ofEpochSecond(3_000));

        assertThat(purged).extracting(LedgerEntry::partitionKey).containsExactly("transaction#t1");
        assertThat(store.size()).isEqualTo(2);
    }

    private LedgerEntry entry(String pk, String sk, String indexKey, Long ttl) {
        return new LedgerEntry(pk, sk, indexKey, mapper.createObjectNode().put("pk", pk), ttl);
    }
}
