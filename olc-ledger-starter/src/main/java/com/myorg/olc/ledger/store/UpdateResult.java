package com.myorg.olc.ledger.store;

/**
 * Result of a conditional update. {@code entry} is the stored row after the update when
 * {@link Status#APPLIED}, the unchanged row when {@link Status#CONDITION_FAILED}, and null when
 * {@link Status#NOT_FOUND}.
 */
public record UpdateResult(Status status, LedgerEntry entry) {

    public enum Status { APPLIED, CONDITION_FAILED, NOT_FOUND }

    public static UpdateResult applied(LedgerEntry e) { return new UpdateResult(Status.APPLIED, e); }
    public static UpdateResult conditionFailed(LedgerEntry e) { return new UpdateResult(Status.CONDITION_FAILED, e); }
    public static UpdateResult notFound() { return new UpdateResult(Status.NOT_FOUND, null); }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }
}
