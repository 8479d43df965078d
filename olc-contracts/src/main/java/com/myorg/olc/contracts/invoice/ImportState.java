package com.myorg.olc.contracts.invoice;

import java.util.EnumSet;
import java.util.Set;

public enum ImportState {
    STARTED,
    URL_ISSUED,
    PROCESSING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public static final Set<ImportState> CANCELLABLE = EnumSet.of(URL_ISSUED, PROCESSING);

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
