package com.myorg.olc.observability;

import com.myorg.olc.contracts.core.envelope.EventEnvelope;
import com.myorg.olc.eventing.dispatch.OrderEventDispatcher;
import com.myorg.olc.eventing.routing.RoutingReport;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;

/**
 * Puts the event into the MDC for the duration of the fan-out and times it.
 */
@RequiredArgsConstructor
public class ObservingOrderEventDispatcher implements OrderEventDispatcher {

    private final OrderEventDispatcher delegate;
    private final OlcObservabilityProperties props;
    private final OlcMetrics metrics; // null when metrics are off

    @Override
    public RoutingReport dispatch(EventEnvelope env) {
        if (props.isMdcEnabled()) {
            OlcMdc.put(OlcContext.of(env));
        }
        boolean measure = metrics != null && props.isMetricsEnabled();
        Timer.Sample sample = measure ? metrics.startTimer() : null;

        try {
            RoutingReport report = delegate.dispatch(env);
            if (measure) {
                boolean complete = report == null || report.isComplete();
                if (complete) metrics.incSuccess();
                else metrics.incIncomplete();
                metrics.stopTimer(sample, env, complete ? "success" : "incomplete");
            }
            return report;
        } catch (RuntimeException e) {
            if (measure) {
                metrics.incFail();
                metrics.stopTimer(sample, env, "fail");
            }
            throw e;
        } finally {
            if (props.isMdcEnabled()) {
                OlcMdc.clear();
            }
        }
    }
}
