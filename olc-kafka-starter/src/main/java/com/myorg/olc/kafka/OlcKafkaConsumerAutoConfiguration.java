package com.myorg.olc.kafka;

import com.myorg.olc.contracts.core.envelope.EventEnvelope;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;

@AutoConfiguration(
        before = org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration.class,
        after = OlcKafkaErrorHandlingAutoConfiguration.class
)
@ConditionalOnClass(ConcurrentKafkaListenerContainerFactory.class)
@EnableConfigurationProperties(OlcKafkaProperties.class)
public class OlcKafkaConsumerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ConsumerFactory<String, Object> consumerFactory(OlcKafkaProperties props) {
        Map<String, Object> c = new HashMap<>();
        c.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());

        c.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        // a record that cannot be parsed reaches the error handler as a DeserializationException
        c.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ErrorHandlingDeserializer.class);
        c.put(ErrorHandlingDeserializer.VALUE_DESERIALIZER_CLASS, JsonDeserializer.class);
        c.put(JsonDeserializer.VALUE_DEFAULT_TYPE, EventEnvelope.class.getName());
        c.put(JsonDeserializer.USE_TYPE_INFO_HEADERS, false);
        c.put(JsonDeserializer.TRUSTED_PACKAGES, props.getConsumer().getTrustedPackages());

        c.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, props.getConsumer().getMaxPollRecords());
        c.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        c.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, props.getConsumer().getAutoOffsetReset());

        if (StringUtils.hasText(props.getConsumer().getGroupId())) {
            c.put(ConsumerConfig.GROUP_ID_CONFIG, props.getConsumer().getGroupId());
        }
        return new DefaultKafkaConsumerFactory<>(c);
    }

    @Bean
    @ConditionalOnMissingBean(name = "kafkaListenerContainerFactory")
    public ConcurrentKafkaListenerContainerFactory<String, Object> kafkaListenerContainerFactory(
            OlcKafkaProperties props,
            ConsumerFactory<String, Object> cf,
            CommonErrorHandler eh
    ) {
        var f = new ConcurrentKafkaListenerContainerFactory<String, Object>();
        f.setConsumerFactory(cf);
        f.setConcurrency(props.getConsumer().getConcurrency());
        // one record at a time: a record is committed only after fan-out finished
        f.getContainerProperties().setAckMode(ContainerProperties.AckMode.RECORD);
        f.setCommonErrorHandler(eh);
        return f;
    }
}
