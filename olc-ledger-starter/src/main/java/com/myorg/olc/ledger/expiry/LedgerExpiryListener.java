package com.myorg.olc.ledger.expiry;

import com.myorg.olc.ledger.store.LedgerEntry;

/**
 * Receives the last image of every entry removed because its ttl passed.
 */
public interface LedgerExpiryListener {
    void onExpired(LedgerEntry oldImage);
}
