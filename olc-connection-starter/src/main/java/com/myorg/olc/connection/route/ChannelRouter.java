package com.myorg.olc.connection.route;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class ChannelRouter {

    public static final String ACTION_FIELD = "action";

    private final Map<String, ChannelRouteHandler> routes;

    public ChannelRouter(Collection<ChannelRouteHandler> handlers) {
        Map<String, ChannelRouteHandler> m = new LinkedHashMap<>();
        for (ChannelRouteHandler h : handlers) {
            ChannelRouteHandler prev = m.putIfAbsent(h.action(), h);
            if (prev != null) {
                throw new IllegalStateException("Duplicate channel route for action '" + h.action() + "': "
                        + prev.getClass().getName() + " and " + h.getClass().getName());
            }
        }
        this.routes = Collections.unmodifiableMap(m);
    }

    public Optional<ChannelRouteHandler> find(String action) {
        return Optional.ofNullable(action == null ? null : routes.get(action));
    }

    public Collection<String> actions() {
        return routes.keySet();
    }
}
