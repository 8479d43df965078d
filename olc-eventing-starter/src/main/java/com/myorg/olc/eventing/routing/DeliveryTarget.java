package com.myorg.olc.eventing.routing;

/**
 * Hands a routed event to one kind of subscription target. Each call receives its own copy of the event.
 */
public interface DeliveryTarget {

    SubscriptionTarget kind();

    /**
     * @throws RuntimeException when the event could not be recorded anywhere; the router reports it as failed
     */
    DeliveryOutcome deliver(Subscription subscription, RoutedEvent event);
}
