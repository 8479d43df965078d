package com.myorg.olc.invoice.audit;

import com.myorg.olc.contracts.audit.AuditEvent;

/**
 * Fire-and-forget sink for audit events. Nothing in the import flow depends on the outcome.
 */
public interface AuditBus {
    void publish(AuditEvent event);
}
