package com.myorg.olc.eventing.publish;

import com.myorg.olc.contracts.order.OrderEvent;

import java.util.concurrent.CompletableFuture;

public interface OrderEventPublisher {

    /**
     * Publishes the event to the order-events topic.
     *
     * @return future of the message id (the envelope's eventId); completes exceptionally with
     *         {@link PublishException} when the broker does not accept the record
     * @throws com.myorg.olc.contracts.core.exception.ValidationException before anything is sent
     * @throws PublishException if the envelope cannot be serialized or exceeds the size limit
     */
    CompletableFuture<String> publish(OrderEvent event);
}
