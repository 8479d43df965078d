package com.myorg.olc.queue.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.queue.InMemoryQueueRegistry;
import com.myorg.olc.queue.QueueRegistry;
import com.myorg.olc.queue.RedisQueueRegistry;
import com.myorg.olc.queue.consumer.BodyRedactor;
import com.myorg.olc.queue.consumer.DeadLetterReasonClassifier;
import com.myorg.olc.queue.consumer.DefaultDeadLetterReasonClassifier;
import com.myorg.olc.queue.consumer.QueueConsumer;
import com.myorg.olc.queue.consumer.QueueConsumerScheduler;
import com.myorg.olc.queue.consumer.QueueHandlerBinding;
import com.myorg.olc.queue.consumer.QueueMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

@Slf4j
@AutoConfiguration(
        afterName = {
                "com.myorg.olc.ledger.autoconfig.OlcLedgerAutoConfiguration",
                "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration",
                "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
        }
)
@EnableConfigurationProperties(OlcQueueProperties.class)
public class OlcQueueAutoConfiguration {

    // ---------------- store selection ----------------

    @Configuration
    @ConditionalOnProperty(prefix = "olc.queue", name = "store", havingValue = "redis")
    @ConditionalOnMissingClass("org.springframework.data.redis.core.StringRedisTemplate")
    static class MissingRedisDependencyFailFastConfig {
        @Bean
        public Object failFastQueueRedisMissing() {
            throw new IllegalStateException(
                    "olc.queue.store=redis but Redis is not on the classpath. " +
                            "Add spring-boot-starter-data-redis and configure spring.data.redis.*"
            );
        }
    }

    @Configuration
    @ConditionalOnClass(StringRedisTemplate.class)
    @ConditionalOnExpression("'${olc.queue.store:auto}'.toLowerCase() != 'memory'")
    static class RedisQueueConfig {
        @Bean
        @ConditionalOnBean(StringRedisTemplate.class)
        @ConditionalOnMissingBean(QueueRegistry.class)
        QueueRegistry queueRegistry(OlcQueueProperties props,
                                    StringRedisTemplate redis,
                                    ObjectProvider<ObjectMapper> mapper,
                                    ObjectProvider<Clock> clock) {
            log.info("Queue store: redis keyPrefix={}", props.getKeyPrefix());
            return new RedisQueueRegistry(props, clock.getIfAvailable(Clock::systemUTC), redis,
                    mapper.getIfAvailable(ObjectMapper::new));
        }
    }

    @Configuration
    @ConditionalOnExpression("'${olc.queue.store:auto}'.toLowerCase() != 'redis'")
    static class MemoryQueueConfig {
        @Bean
        @ConditionalOnMissingBean(QueueRegistry.class)
        QueueRegistry queueRegistry(OlcQueueProperties props, ObjectProvider<Clock> clock) {
            return new InMemoryQueueRegistry(props, clock.getIfAvailable(Clock::systemUTC));
        }
    }

    // ---------------- consumers ----------------

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterReasonClassifier deadLetterReasonClassifier() {
        return new DefaultDeadLetterReasonClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public BodyRedactor bodyRedactor(OlcQueueProperties props, ObjectProvider<ObjectMapper> mapper) {
        return new BodyRedactor(mapper.getIfAvailable(ObjectMapper::new), props.getRedactedFields());
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "olc.queue", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public QueueMetrics queueMetrics(MeterRegistry registry, QueueRegistry queues) {
        QueueMetrics m = new QueueMetrics(registry, queues);
        m.preRegister();
        return m;
    }

    @Bean(name = "olcQueueSchedule")
    public OlcQueueScheduleValues olcQueueScheduleValues(OlcQueueProperties props) {
        return new OlcQueueScheduleValues(props);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "olc.queue.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
    public QueueConsumerScheduler queueConsumerScheduler(OlcQueueProperties props,
                                                         QueueRegistry queues,
                                                         ObjectProvider<QueueHandlerBinding> bindings,
                                                         DeadLetterReasonClassifier classifier,
                                                         BodyRedactor redactor,
                                                         ObjectProvider<Clock> clock,
                                                         ObjectProvider<QueueMetrics> metrics) {
        OlcQueueProperties.Consumer cfg = props.getConsumer();
        int threads = Math.max(cfg.getWorkerThreads(), cfg.getBatchSize());
        ExecutorService workers = Executors.newFixedThreadPool(threads, namedDaemon("olc-queue-worker-"));

        Clock c = clock.getIfAvailable(Clock::systemUTC);
        List<QueueConsumer> consumers = bindings.orderedStream()
                .map(b -> new QueueConsumer(queues.queue(b.queue()), b.handler(), cfg, workers,
                        classifier, redactor, c, metrics.getIfAvailable()))
                .collect(Collectors.toList());

        consumers.forEach(qc -> log.info("Queue consumer registered queue={}", qc.queueName()));
        return new QueueConsumerScheduler(props, consumers, workers);
    }

    private static java.util.concurrent.ThreadFactory namedDaemon(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Configuration
    @EnableScheduling
    @ConditionalOnProperty(prefix = "olc.queue.consumer", name = "scheduling-enabled", havingValue = "true", matchIfMissing = true)
    static class SchedulingConfig {}
}
