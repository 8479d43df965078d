package com.myorg.olc.example;

import com.myorg.olc.contracts.order.OrderEvent;
import com.myorg.olc.contracts.order.OrderEventType;
import com.myorg.olc.eventing.publish.OrderEventPublisher;
import com.myorg.olc.ledger.order.OrderEventLedger;
import com.myorg.olc.ledger.store.LedgerEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

@RestController
@RequestMapping("/orders/events")
@RequiredArgsConstructor
public class OrderEventsController {

    private final OrderEventPublisher publisher;
    private final OrderEventLedger ledger;

    @PostMapping
    public Map<String, String> publish(@RequestBody OrderEvent event) throws InterruptedException, ExecutionException {
        OrderEvent stamped = event.getTimestamp() > 0 ? event : event.toBuilder().timestamp(System.currentTimeMillis()).build();
        String messageId = publisher.publish(stamped).get();
        return Map.of("messageId", messageId);
    }

    @GetMapping
    public List<OrderEvent> byRequester(@RequestParam String email,
                                        @RequestParam(required = false) OrderEventType eventType) {
        List<OrderEvent> out = new ArrayList<>();
        for (LedgerEntry e : ledger.queryByRequester(email, eventType)) {
            out.add(ledger.toEvent(e));
        }
        return out;
    }
}
