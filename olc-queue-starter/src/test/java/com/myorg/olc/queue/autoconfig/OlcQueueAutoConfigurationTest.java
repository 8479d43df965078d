package com.myorg.olc.queue.autoconfig;

import com.myorg.olc.queue.InMemoryQueueRegistry;
import com.myorg.olc.queue.QueueRegistry;
import com.myorg.olc.queue.consumer.QueueConsumerScheduler;
import com.myorg.olc.queue.consumer.QueueHandlerBinding;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class OlcQueueAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(OlcQueueAutoConfiguration.class))
            .withPropertyValues(
                    "olc.queue.consumer.scheduling-enabled=false",
                    "olc.queue.queues.order-emails.max-receive-count=3",
                    "olc.queue.queues.order-emails.dead-letter-queue=order-emails-dlq");

    @Test
    void declaredQueuesAndTheirDeadLetterQueuesExistAtStartup() {
        runner.run(ctx -> {
            QueueRegistry registry = ctx.getBean(QueueRegistry.class);
            assertThat(registry.find("order-emails")).isPresent();
            assertThat(registry.find("order-emails-dlq")).isPresent();
            assertThat(registry.queue("order-emails").deadLetterPolicy().orElseThrow().maxReceiveCount()).isEqualTo(3);
        });
    }

    @Test
    void bindingBecomesConsumer() {
        runner.withUserConfiguration(BindingConfig.class).run(ctx -> {
            QueueConsumerScheduler scheduler = ctx.getBean(QueueConsumerScheduler.class);
            assertThat(scheduler.consumers()).singleElement()
                    .extracting(c -> c.queueName()).isEqualTo("order-emails");
        });
    }

    @Test
    void autoFallsBackToMemoryWithoutRedisTemplate() {
        runner.run(ctx -> assertThat(ctx.getBean(QueueRegistry.class)).isInstanceOf(InMemoryQueueRegistry.class));
    }

    @Test
    void redisStoreWithoutRedisTemplateFailsStartup() {
        runner.withPropertyValues("olc.queue.store=redis")
                .run(ctx -> assertThat(ctx).hasFailed());
    }

    @Configuration
    static class BindingConfig {
        @Bean
        QueueHandlerBinding emails() {
            return new QueueHandlerBinding("order-emails", m -> { });
        }
    }
}
