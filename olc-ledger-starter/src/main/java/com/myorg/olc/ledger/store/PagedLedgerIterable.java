package com.myorg.olc.ledger.store;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Lazy view over a paged query. Pages are fetched only when iteration reaches them and every
 * call to {@link #iterator()} starts again from the first page.
 */
public class PagedLedgerIterable implements Iterable<LedgerEntry> {

    private final Function<String, LedgerPage> pageFetcher;

    /**
     * @param pageFetcher receives the cursor (null for the first page) and returns the next page
     */
    public PagedLedgerIterable(Function<String, LedgerPage> pageFetcher) {
        this.pageFetcher = pageFetcher;
    }

    @Override
    public Iterator<LedgerEntry> iterator() {
        return new Iterator<>() {
            private List<LedgerEntry> page = List.of();
            private int pos = 0;
            private String cursor = null;
            private boolean exhausted = false;

            @Override
            public boolean hasNext() {
                while (pos >= page.size()) {
                    if (exhausted) return false;
                    LedgerPage next = pageFetcher.apply(cursor);
                    page = next.items();
                    pos = 0;
                    cursor = next.lastEvaluatedKey();
                    exhausted = !next.hasMore();
                }
                return true;
            }

            @Override
            public LedgerEntry next() {
                if (!hasNext()) throw new NoSuchElementException();
                return page.get(pos++);
            }
        };
    }
}
