package com.myorg.olc.queue.consumer;

import com.myorg.olc.queue.QueueMessage;

// decides whether a failure is worth another attempt, and what to record if it is not
public interface DeadLetterReasonClassifier {

    record Decision(String reason, boolean nonRetryable) {}

    Decision classify(QueueMessage message, Throwable failure);
}
