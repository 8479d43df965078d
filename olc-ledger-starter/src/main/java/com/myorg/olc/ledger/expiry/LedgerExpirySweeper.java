package com.myorg.olc.ledger.expiry;

import com.myorg.olc.ledger.autoconfig.OlcLedgerProperties;
import com.myorg.olc.ledger.store.LedgerEntry;
import com.myorg.olc.ledger.store.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.util.List;

@Slf4j
@RequiredArgsConstructor
public class LedgerExpirySweeper {

    private final OlcLedgerProperties props;
    private final LedgerStore store;
    private final Clock clock;
    private final List<LedgerExpiryListener> listeners;

    @Scheduled(
            initialDelayString = "#{@olcLedgerSchedule.initialDelayMs}",
            fixedDelayString = "#{@olcLedgerSchedule.sweepIntervalMs}"
    )
    public void scheduledLoop() {
        if (!props.getSweeper().isSchedulingEnabled()) return;
        runOnce();
    }

    /** @return number of entries purged */
    public int runOnce() {
        if (!props.getSweeper().isEnabled()) return 0;

        List<LedgerEntry> purged = store.purgeExpired(clock.instant());
        for (LedgerEntry e : purged) {
            for (LedgerExpiryListener l : listeners) {
                try {
                    l.onExpired(e);
                } catch (RuntimeException ex) {
                    // one listener must not starve the others; the entry is gone either way
                    log.warn("Expiry listener {} failed pk={} sk={}", l.getClass().getSimpleName(),
                            e.partitionKey(), e.sortKey(), ex);
                }
            }
        }
        return purged.size();
    }
}
