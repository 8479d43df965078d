package com.myorg.olc.eventing.routing.target;

import com.myorg.olc.eventing.routing.DeliveryOutcome;
import com.myorg.olc.eventing.routing.DeliveryTarget;
import com.myorg.olc.eventing.routing.RoutedEvent;
import com.myorg.olc.eventing.routing.Subscription;
import com.myorg.olc.eventing.routing.SubscriptionTarget;
import com.myorg.olc.ledger.order.OrderEventLedger;
import lombok.RequiredArgsConstructor;

/**
 * Appends to the order event ledger. A redelivered event finds its row already there and counts as delivered.
 */
@RequiredArgsConstructor
public class LedgerDeliveryTarget implements DeliveryTarget {

    private final OrderEventLedger ledger;

    @Override
    public SubscriptionTarget kind() {
        return SubscriptionTarget.LEDGER;
    }

    @Override
    public DeliveryOutcome deliver(Subscription s, RoutedEvent routed) {
        ledger.append(routed.event());
        return DeliveryOutcome.DELIVERED;
    }
}
