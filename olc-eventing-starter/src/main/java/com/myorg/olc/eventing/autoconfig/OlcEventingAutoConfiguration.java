package com.myorg.olc.eventing.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.eventing.dispatch.EnvelopeConverter;
import com.myorg.olc.eventing.dispatch.JacksonEnvelopeConverter;
import com.myorg.olc.eventing.dispatch.OrderEventDispatcher;
import com.myorg.olc.eventing.dispatch.OrderEventTopicListener;
import com.myorg.olc.eventing.dispatch.RoutingOrderEventDispatcher;
import com.myorg.olc.eventing.publish.KafkaOrderEventPublisher;
import com.myorg.olc.eventing.publish.OrderEventPublisher;
import com.myorg.olc.eventing.routing.DeliveryTarget;
import com.myorg.olc.eventing.routing.FanOutRouter;
import com.myorg.olc.eventing.routing.RouterMetrics;
import com.myorg.olc.eventing.routing.RoutingTable;
import com.myorg.olc.eventing.routing.SubscriptionTarget;
import com.myorg.olc.eventing.routing.target.DirectDeliveryTarget;
import com.myorg.olc.eventing.routing.target.LedgerDeliveryTarget;
import com.myorg.olc.eventing.routing.target.QueueDeliveryTarget;
import com.myorg.olc.eventing.subscriber.SubscriberRegistry;
import com.myorg.olc.eventing.subscriber.SubscriberScanner;
import com.myorg.olc.kafka.OlcKafkaProperties;
import com.myorg.olc.ledger.order.OrderEventLedger;
import com.myorg.olc.queue.QueueRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.stream.Collectors;

@Slf4j
@AutoConfiguration(afterName = {
        "com.myorg.olc.kafka.OlcKafkaConsumerAutoConfiguration",
        "com.myorg.olc.ledger.autoconfig.OlcLedgerAutoConfiguration",
        "com.myorg.olc.queue.autoconfig.OlcQueueAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@EnableConfigurationProperties(OlcEventingProperties.class)
@ConditionalOnClass(KafkaTemplate.class)
public class OlcEventingAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SubscriberRegistry subscriberRegistry() {
        return new SubscriberRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriberScanner olcSubscriberScanner(ApplicationContext ctx, SubscriberRegistry registry) {
        SubscriberScanner scanner = new SubscriberScanner(registry);
        scanner.scan(ctx);
        return scanner;
    }

    @Bean
    @ConditionalOnMissingBean
    public RoutingTable routingTable(OlcEventingProperties props) {
        RoutingTable table = RoutingTable.from(props.getRouting());
        table.subscriptions().forEach(s -> log.info("Subscription name={} target={} filter={}{}",
                s.name(), s.target(), s.filter(), s.target() == SubscriptionTarget.QUEUE ? " queue=" + s.queue() : ""));
        return table;
    }

    @Bean
    @ConditionalOnMissingBean
    public DirectDeliveryTarget directDeliveryTarget(SubscriberRegistry subscribers,
                                                     QueueRegistry queues,
                                                     RoutingTable table,
                                                     ObjectProvider<ObjectMapper> mapper,
                                                     ObjectProvider<Clock> clock) {
        // dead-letter queues of DIRECT subscriptions exist up front so operators can peek them
        table.byTarget(SubscriptionTarget.DIRECT).forEach(s -> queues.queue(s.deadLetterQueue()));
        return new DirectDeliveryTarget(subscribers, queues, mapper.getIfAvailable(ObjectMapper::new),
                clock.getIfAvailable(Clock::systemUTC));
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueDeliveryTarget queueDeliveryTarget(QueueRegistry queues, ObjectProvider<ObjectMapper> mapper) {
        return new QueueDeliveryTarget(queues, mapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public LedgerDeliveryTarget ledgerDeliveryTarget(OrderEventLedger ledger) {
        return new LedgerDeliveryTarget(ledger);
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    public RouterMetrics routerMetrics(MeterRegistry registry, RoutingTable table) {
        RouterMetrics m = new RouterMetrics(registry);
        m.preRegister(table);
        return m;
    }

    @Bean
    @ConditionalOnMissingBean
    public FanOutRouter fanOutRouter(RoutingTable table,
                                     ObjectProvider<DeliveryTarget> targets,
                                     ObjectProvider<ObjectMapper> mapper,
                                     ObjectProvider<RouterMetrics> metrics,
                                     OlcEventingProperties props,
                                     Environment env) {
        return new FanOutRouter(table, targets.orderedStream().collect(Collectors.toList()),
                mapper.getIfAvailable(ObjectMapper::new), producerName(props, env), metrics.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public OrderEventPublisher orderEventPublisher(KafkaTemplate<String, Object> template,
                                                   ObjectProvider<ObjectMapper> mapper,
                                                   OlcEventingProperties props,
                                                   Environment env) {
        return new KafkaOrderEventPublisher(template, mapper.getIfAvailable(ObjectMapper::new),
                props.getTopic(), producerName(props, env), props.getMaxMessageBytes());
    }

    @Bean
    @ConditionalOnMissingBean
    public OrderEventDispatcher orderEventDispatcher(FanOutRouter router, OlcEventingProperties props) {
        return new RoutingOrderEventDispatcher(router, props.isIgnoreUnknownEventType());
    }

    @Bean
    @ConditionalOnMissingBean
    public EnvelopeConverter envelopeConverter(ObjectProvider<ObjectMapper> mapper) {
        return new JacksonEnvelopeConverter(mapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnProperty(prefix = "olc.eventing.listener", name = "enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnExpression(
            "('${olc.eventing.consume-topics:}'.length() > 0) || ('${olc.eventing.consume-topics[0]:}'.length() > 0)"
    )
    public OrderEventTopicListener orderEventTopicListener(OrderEventDispatcher dispatcher, EnvelopeConverter converter) {
        return new OrderEventTopicListener(dispatcher, converter);
    }

    /**
     * Consume topics as a {@code String[]} bean for the SpEL in {@code @KafkaListener}.
     * YAML lists are not reliably "present" for {@code @ConditionalOnProperty}, hence the expression.
     */
    @Bean(name = "olcConsumeTopics")
    @ConditionalOnExpression(
            "('${olc.eventing.consume-topics:}'.length() > 0) || ('${olc.eventing.consume-topics[0]:}'.length() > 0)"
    )
    public String[] olcConsumeTopics(OlcEventingProperties props) {
        return props.getConsumeTopics().toArray(String[]::new);
    }

    @Bean
    @ConditionalOnBean(KafkaAdmin.class)
    @ConditionalOnProperty(prefix = "olc.eventing.topics", name = "create", havingValue = "true")
    public KafkaAdmin.NewTopics olcOrderEventTopics(OlcEventingProperties props, ObjectProvider<OlcKafkaProperties> kafka) {
        String dlqSuffix = kafka.getIfAvailable(OlcKafkaProperties::new).getDlq().getSuffix();
        var t = props.getTopics();
        NewTopic main = TopicBuilder.name(props.getTopic()).partitions(t.getPartitions()).replicas(t.getReplicas()).build();
        NewTopic dlq = TopicBuilder.name(props.getTopic() + dlqSuffix).partitions(t.getPartitions()).replicas(t.getReplicas()).build();
        return new KafkaAdmin.NewTopics(main, dlq);
    }

    private static String producerName(OlcEventingProperties props, Environment env) {
        String producer = props.getProducerName();
        if (!StringUtils.hasText(producer)) {
            producer = env.getProperty("spring.application.name", "unknown-service");
        }
        return producer;
    }
}
