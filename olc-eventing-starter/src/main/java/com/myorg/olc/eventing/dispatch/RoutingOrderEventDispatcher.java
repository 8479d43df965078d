package com.myorg.olc.eventing.dispatch;

import com.myorg.olc.contracts.core.envelope.EventEnvelope;
import com.myorg.olc.contracts.order.OrderEventType;
import com.myorg.olc.eventing.routing.FanOutRouter;
import com.myorg.olc.eventing.routing.RoutingReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

@Slf4j
@RequiredArgsConstructor
public class RoutingOrderEventDispatcher implements OrderEventDispatcher {

    private static final RoutingReport SKIPPED = new RoutingReport(List.of(), List.of(), List.of(), Map.of());

    private final FanOutRouter router;
    private final boolean ignoreUnknownEventType;

    @Override
    public RoutingReport dispatch(EventEnvelope env) {
        boolean known = Arrays.stream(OrderEventType.values()).anyMatch(t -> t.name().equals(env.getEventType()));
        if (!known) {
            if (ignoreUnknownEventType) {
                log.warn("Skipping unknown eventType={} eventId={}", env.getEventType(), env.getEventId());
                return SKIPPED;
            }
            throw new UnknownEventTypeException(env.getEventType(), env.getEventId());
        }
        return router.route(env);
    }
}
