package com.myorg.olc.eventing.routing;

import com.myorg.olc.eventing.autoconfig.OlcEventingProperties;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable list of subscriptions, loaded once at startup.
 */
public final class RoutingTable {

    private final List<Subscription> subscriptions;

    public RoutingTable(List<Subscription> subscriptions) {
        Set<String> names = new HashSet<>();
        for (Subscription s : subscriptions) {
            if (!names.add(s.name())) {
                throw new IllegalStateException("Duplicate subscription name '" + s.name() + "'");
            }
            if (s.target() == SubscriptionTarget.QUEUE && !StringUtils.hasText(s.queue())) {
                throw new IllegalStateException("Subscription '" + s.name() + "' targets QUEUE but names no queue");
            }
        }
        this.subscriptions = List.copyOf(subscriptions);
    }

    public static RoutingTable from(OlcEventingProperties.Routing routing) {
        List<Subscription> out = new ArrayList<>();
        for (OlcEventingProperties.SubscriptionSpec spec : routing.getSubscriptions()) {
            if (!StringUtils.hasText(spec.getName())) {
                throw new IllegalStateException("Every subscription needs a name");
            }
            if (spec.getTarget() == null) {
                throw new IllegalStateException("Subscription '" + spec.getName() + "' has no target");
            }
            FilterExpression filter;
            try {
                filter = FilterExpression.compile(spec.getFilter());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Subscription '" + spec.getName() + "': " + e.getMessage(), e);
            }
            out.add(new Subscription(
                    spec.getName(),
                    filter,
                    spec.getTarget(),
                    spec.getQueue(),
                    new Subscription.Retry(spec.getRetry().getMaxAttempts(), spec.getRetry().getBackoff())
            ));
        }
        return new RoutingTable(out);
    }

    public List<Subscription> subscriptions() {
        return subscriptions;
    }

    public List<Subscription> byTarget(SubscriptionTarget target) {
        return subscriptions.stream().filter(s -> s.target() == target).toList();
    }
}
