package com.myorg.olc.kafka;

import com.myorg.olc.contracts.core.exception.OlcNonRetryableException;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.errors.SerializationException;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.kafka.support.serializer.DeserializationException;

public class DefaultKafkaDlqReasonClassifier implements KafkaDlqReasonClassifier {

    static final String DESERIALIZATION = "DESERIALIZATION";
    static final String RETRY_EXHAUSTED = "RETRY_EXHAUSTED";

    @Override
    public Decision classify(ConsumerRecord<?, ?> record, Exception ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);

        if (root instanceof DeserializationException || root instanceof SerializationException) {
            return new Decision(DESERIALIZATION, true);
        }

        // the listener adapter wraps handler exceptions, so look through the chain
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof OlcNonRetryableException nre) {
                return new Decision(nre.getReason(), true);
            }
            if (t.getCause() == t) break;
        }

        return new Decision(RETRY_EXHAUSTED, false);
    }
}
