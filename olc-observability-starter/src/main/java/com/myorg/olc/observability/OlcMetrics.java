package com.myorg.olc.observability;

import com.myorg.olc.contracts.core.envelope.EventEnvelope;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class OlcMetrics {

    public static final String HANDLED_SUCCESS = "olc.event.handled.success";
    public static final String HANDLED_FAIL = "olc.event.handled.fail";
    public static final String INCOMPLETE = "olc.event.incomplete";
    public static final String PROCESSING = "olc.event.processing";

    private final MeterRegistry registry;
    private final String serviceName;
    private final OlcObservabilityProperties props;

    private Counter cSuccess;
    private Counter cFail;
    private Counter cIncomplete;

    /** Call once on startup so the base meters exist before the first event. */
    public void preRegisterBaseMeters() {
        cSuccess = Counter.builder(HANDLED_SUCCESS).tag("service", serviceName).register(registry);
        cFail = Counter.builder(HANDLED_FAIL).tag("service", serviceName).register(registry);
        cIncomplete = Counter.builder(INCOMPLETE).tag("service", serviceName).register(registry);
        Timer.builder(PROCESSING).tag("service", serviceName).register(registry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopTimer(Timer.Sample sample, EventEnvelope env, String outcome) {
        if (sample == null) return;

        Timer.Builder b = Timer.builder(PROCESSING).tag("service", serviceName);
        if (props.isTagOutcome()) b.tag("outcome", outcome);
        if (props.isTagEventType() && env != null && env.getEventType() != null) b.tag("eventType", env.getEventType());

        sample.stop(b.register(registry));
    }

    public void incSuccess() { if (cSuccess != null) cSuccess.increment(); }
    public void incFail() { if (cFail != null) cFail.increment(); }
    public void incIncomplete() { if (cIncomplete != null) cIncomplete.increment(); }
}
