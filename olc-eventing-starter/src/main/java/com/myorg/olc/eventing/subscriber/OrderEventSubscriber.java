package com.myorg.olc.eventing.subscriber;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a bean method as the handler of a DIRECT subscription.
 * Supported signatures: {@code (OrderEvent)} or {@code (EventEnvelope, OrderEvent)}.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface OrderEventSubscriber {
    /** Subscription name, as declared under olc.eventing.routing.subscriptions. */
    String value();
}
