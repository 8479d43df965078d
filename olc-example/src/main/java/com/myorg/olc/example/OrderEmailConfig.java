package com.myorg.olc.example;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.contracts.core.envelope.EventEnvelope;
import com.myorg.olc.contracts.order.OrderEvent;
import com.myorg.olc.queue.consumer.QueueHandlerBinding;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Consumes the order-emails queue filled by the QUEUE subscription "emails".
 */
@Slf4j
@Configuration
public class OrderEmailConfig {

    public static final String QUEUE = "order-emails";
    public static final String SENT = "olc.example.emails.sent";

    @Bean
    public QueueHandlerBinding orderEmailBinding(ObjectMapper mapper, MeterRegistry registry) {
        Counter sent = registry.counter(SENT);
        return new QueueHandlerBinding(QUEUE, message -> {
            EventEnvelope env = mapper.readValue(message.body(), EventEnvelope.class);
            OrderEvent event = mapper.treeToValue(env.getPayload(), OrderEvent.class);
            if (event.getOrderId().startsWith("FAIL_")) {
                throw new IllegalStateException("mail server refused orderId=" + event.getOrderId());
            }
            // the address stays out of the log
            log.info("Order confirmation mailed orderId={} attempt={}", event.getOrderId(), message.receiveCount());
            sent.increment();
        });
    }
}
