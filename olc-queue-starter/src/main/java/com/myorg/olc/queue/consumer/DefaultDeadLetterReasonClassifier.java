package com.myorg.olc.queue.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.myorg.olc.contracts.core.exception.OlcNonRetryableException;
import com.myorg.olc.queue.QueueMessage;
import org.springframework.core.NestedExceptionUtils;

// Unreadable bodies and OlcNonRetryableException go straight to the DLQ; anything else is retried.
public class DefaultDeadLetterReasonClassifier implements DeadLetterReasonClassifier {

    @Override
    public Decision classify(QueueMessage message, Throwable failure) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(failure);

        if (failure instanceof OlcNonRetryableException nre) {
            return new Decision(nre.getReason(), true);
        }
        if (root instanceof OlcNonRetryableException nre) {
            return new Decision(nre.getReason(), true);
        }
        if (root instanceof JsonProcessingException) {
            return new Decision(DeadLetterReason.DESERIALIZATION.code(), true);
        }
        if (failure instanceof InvocationTimeoutException) {
            return new Decision(DeadLetterReason.TIMEOUT.code(), false);
        }
        return new Decision(DeadLetterReason.RETRY_EXHAUSTED.code(), false);
    }
}
