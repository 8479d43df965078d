package com.myorg.olc.eventing.dispatch;

import com.myorg.olc.contracts.core.exception.OlcRetryableException;
import com.myorg.olc.eventing.routing.RoutingReport;

/**
 * Some subscriptions could not be reached. Thrown from the listener so the record is redelivered;
 * subscribers that already got the event see it again.
 */
public class FanOutIncompleteException extends OlcRetryableException {

    private final transient RoutingReport report;

    public FanOutIncompleteException(String eventId, RoutingReport report) {
        super("Fan-out incomplete eventId=" + eventId + " failed=" + report.failed().keySet());
        this.report = report;
    }

    public RoutingReport getReport() {
        return report;
    }
}
