package com.myorg.olc.kafka;

import org.apache.kafka.clients.consumer.ConsumerRecord;

/**
 * Decides the reason code stamped on a record sent to the topic's dead-letter topic.
 */
public interface KafkaDlqReasonClassifier {

    record Decision(String reason, boolean nonRetryable) {}

    Decision classify(ConsumerRecord<?, ?> record, Exception ex);
}
