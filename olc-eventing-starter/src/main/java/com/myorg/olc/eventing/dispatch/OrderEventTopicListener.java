package com.myorg.olc.eventing.dispatch;

import com.myorg.olc.contracts.core.envelope.EventEnvelope;
import com.myorg.olc.eventing.routing.RoutingReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;

/**
 * Consumes the order-events topic one record at a time. The offset is committed only after the
 * record has been fanned out to every matching subscription.
 */
@Slf4j
@RequiredArgsConstructor
public class OrderEventTopicListener {

    private final OrderEventDispatcher dispatcher;
    private final EnvelopeConverter converter;

    @KafkaListener(
            id = "olcOrderEventListener",
            topics = "#{@olcConsumeTopics}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void onMessage(ConsumerRecord<String, Object> record) {
        EventEnvelope env = converter.toEnvelope(record.value());
        if (env == null) return;

        RoutingReport report = dispatcher.dispatch(env);
        if (!report.isComplete()) {
            throw new FanOutIncompleteException(env.getEventId(), report);
        }
    }
}
