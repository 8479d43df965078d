package com.myorg.olc.eventing.dispatch;

import com.myorg.olc.contracts.core.envelope.EventEnvelope;
import com.myorg.olc.eventing.routing.RoutingReport;

public interface OrderEventDispatcher {
    RoutingReport dispatch(EventEnvelope env);
}
