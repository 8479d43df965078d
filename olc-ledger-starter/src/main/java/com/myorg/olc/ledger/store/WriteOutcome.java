package com.myorg.olc.ledger.store;

public enum WriteOutcome {
    WRITTEN,
    ALREADY_EXISTS
}
