package com.myorg.olc.eventing.dispatch;

import com.myorg.olc.contracts.core.envelope.EventEnvelope;

public interface EnvelopeConverter {
    /** @return null for tombstones */
    EventEnvelope toEnvelope(Object value);
}
