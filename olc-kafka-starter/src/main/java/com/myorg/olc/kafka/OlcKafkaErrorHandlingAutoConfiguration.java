package com.myorg.olc.kafka;

import com.myorg.olc.contracts.core.exception.OlcNonRetryableException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.header.Headers;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.core.env.Environment;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.DeserializationException;
import org.springframework.util.backoff.FixedBackOff;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Retry with fixed backoff, then publish the failed record to {@code <topic><suffix>} with reason headers.
 */
@Slf4j
@AutoConfiguration(
        before = org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration.class,
        after = OlcKafkaProducerAutoConfiguration.class
)
@ConditionalOnClass(DefaultErrorHandler.class)
@EnableConfigurationProperties(OlcKafkaProperties.class)
public class OlcKafkaErrorHandlingAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public KafkaDlqReasonClassifier kafkaDlqReasonClassifier() {
        return new DefaultKafkaDlqReasonClassifier();
    }

    @Bean
    @ConditionalOnProperty(prefix = "olc.kafka.dlq", name = "enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnMissingBean
    public DeadLetterPublishingRecoverer dlqRecoverer(
            OlcKafkaProperties props,
            ObjectProvider<KafkaTemplate<String, Object>> templateProvider,
            Environment env,
            KafkaDlqReasonClassifier classifier,
            ObjectProvider<Clock> clock
    ) {
        KafkaTemplate<String, Object> template = templateProvider.getIfAvailable();
        if (template == null) {
            throw new IllegalStateException(
                    "olc.kafka.dlq.enabled=true but no KafkaTemplate<String,Object> is available. "
                            + "Load the olc-kafka-starter producer auto-configuration or declare a producer.");
        }

        String suffix = props.getDlq().getSuffix();
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(
                template,
                (rec, ex) -> new TopicPartition(rec.topic() + suffix, rec.partition())
        );

        String service = env.getProperty("spring.application.name", "unknown-service");
        Clock c = clock.getIfAvailable(Clock::systemUTC);
        recoverer.setHeadersFunction((rec, ex) -> dlqHeaders(rec, ex, classifier, service, c));
        return recoverer;
    }

    @Bean
    @ConditionalOnMissingBean
    public CommonErrorHandler commonErrorHandler(
            OlcKafkaProperties props,
            ObjectProvider<DeadLetterPublishingRecoverer> recovererProvider,
            Environment env,
            ObjectProvider<MeterRegistry> registryProvider
    ) {
        long interval = props.getConsumer().getRetry().getBackoff().toMillis();
        long attempts = props.getConsumer().getRetry().getAttempts();
        var backoff = new FixedBackOff(interval, attempts);

        DeadLetterPublishingRecoverer recoverer = recovererProvider.getIfAvailable();
        DefaultErrorHandler handler = (props.getDlq().isEnabled() && recoverer != null)
                ? new DefaultErrorHandler(recoverer, backoff)
                : new DefaultErrorHandler(backoff);

        handler.setCommitRecovered(true);
        handler.addNotRetryableExceptions(
                SerializationException.class,
                DeserializationException.class,
                OlcNonRetryableException.class
        );
        handler.setRetryListeners(new KafkaRetryDlqMetricsListener(
                env.getProperty("spring.application.name", "unknown-service"), registryProvider));
        return handler;
    }

    /**
     * Pre-register the base meters so /actuator/metrics/olc.kafka.* answers before the first failure.
     */
    @Bean
    public ApplicationRunner olcKafkaMetricsPreregister(ObjectProvider<MeterRegistry> registryProvider) {
        return args -> {
            MeterRegistry reg = registryProvider.getIfAvailable();
            if (reg == null) return;
            Counter.builder(KafkaRetryDlqMetricsListener.RETRY).register(reg);
            Counter.builder(KafkaRetryDlqMetricsListener.DLQ).register(reg);
            Counter.builder(KafkaRetryDlqMetricsListener.RECOVERY_FAILED).register(reg);
        };
    }

    static Headers dlqHeaders(ConsumerRecord<?, ?> rec, Exception ex,
                              KafkaDlqReasonClassifier classifier, String service, Clock clock) {
        RecordHeaders headers = new RecordHeaders();
        KafkaDlqReasonClassifier.Decision decision = classifier.classify(rec, ex);
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);

        putHeader(headers, KafkaDlqHeaders.REASON, decision.reason());
        putHeader(headers, KafkaDlqHeaders.NON_RETRYABLE, String.valueOf(decision.nonRetryable()));
        putHeader(headers, KafkaDlqHeaders.EXCEPTION_CLASS, root.getClass().getName());
        putHeader(headers, KafkaDlqHeaders.EXCEPTION_MESSAGE, safeMsg(root.getMessage(), 512));
        putHeader(headers, KafkaDlqHeaders.SERVICE, service);
        putHeader(headers, KafkaDlqHeaders.TS_MS, String.valueOf(clock.millis()));
        return headers;
    }

    private static void putHeader(Headers headers, String key, String value) {
        headers.add(key, (value == null ? "" : value).getBytes(StandardCharsets.UTF_8));
    }

    private static String safeMsg(String msg, int maxLen) {
        if (msg == null) return "";
        return msg.length() <= maxLen ? msg : msg.substring(0, maxLen);
    }
}
