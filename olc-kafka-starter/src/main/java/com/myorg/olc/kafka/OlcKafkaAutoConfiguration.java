package com.myorg.olc.kafka;

import org.apache.kafka.clients.admin.AdminClientConfig;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.KafkaAdmin;

import java.util.HashMap;
import java.util.Map;

@AutoConfiguration(before = org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration.class)
@ConditionalOnClass(KafkaAdmin.class)
@EnableConfigurationProperties(OlcKafkaProperties.class)
public class OlcKafkaAutoConfiguration {

    /**
     * KafkaAdmin bound to olc.kafka.bootstrap-servers so NewTopic beans are applied against the same cluster
     * (Boot's own KafkaAdmin reads spring.kafka.bootstrap-servers, which this stack does not use).
     */
    @Bean
    @ConditionalOnMissingBean
    public KafkaAdmin kafkaAdmin(OlcKafkaProperties props) {
        Map<String, Object> cfg = new HashMap<>();
        cfg.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());
        KafkaAdmin admin = new KafkaAdmin(cfg);
        admin.setFatalIfBrokerNotAvailable(false);
        return admin;
    }
}
