package com.myorg.olc.ledger.transaction;

import com.myorg.olc.contracts.invoice.ImportTransaction;

/**
 * @param current the stored transaction after the attempt; null when {@link Status#NOT_FOUND}
 */
public record TransitionOutcome(Status status, ImportTransaction current) {

    public enum Status { APPLIED, REJECTED, NOT_FOUND }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }
}
