package com.myorg.olc.ledger.autoconfig;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class OlcLedgerScheduleValues {
    private final OlcLedgerProperties props;

    public long getSweepIntervalMs() { return props.getSweeper().getInterval().toMillis(); }
    public long getInitialDelayMs() { return props.getSweeper().getInitialDelay().toMillis(); }
}
