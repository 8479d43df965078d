package com.myorg.olc.ledger.store;

import java.util.List;

/**
 * @param lastEvaluatedKey cursor to pass back for the next page; null when there is none
 */
public record LedgerPage(List<LedgerEntry> items, String lastEvaluatedKey) {

    public boolean hasMore() {
        return lastEvaluatedKey != null;
    }
}
