package com.myorg.olc.ledger.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.ledger.expiry.LedgerExpiryListener;
import com.myorg.olc.ledger.expiry.LedgerExpirySweeper;
import com.myorg.olc.ledger.order.OrderEventLedger;
import com.myorg.olc.ledger.store.InMemoryLedgerStore;
import com.myorg.olc.ledger.store.LedgerStore;
import com.myorg.olc.ledger.store.RedisLedgerStore;
import com.myorg.olc.ledger.transaction.TransactionLedger;
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
import java.util.stream.Collectors;

@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration")
@EnableConfigurationProperties(OlcLedgerProperties.class)
public class OlcLedgerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock olcClock() {
        return Clock.systemUTC();
    }

    // ---------------- store selection ----------------

    /**
     * store=redis but Redis is not on the classpath -> fail fast.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "olc.ledger", name = "store", havingValue = "redis")
    @ConditionalOnMissingClass("org.springframework.data.redis.core.StringRedisTemplate")
    static class MissingRedisDependencyFailFastConfig {
        @Bean
        public Object failFastRedisMissing() {
            throw new IllegalStateException(
                    "olc.ledger.store=redis but Redis is not on the classpath. " +
                            "Add spring-boot-starter-data-redis and configure spring.data.redis.*"
            );
        }
    }

    @Configuration
    @ConditionalOnClass(StringRedisTemplate.class)
    @ConditionalOnExpression("'${olc.ledger.store:auto}'.toLowerCase() != 'memory'")
    static class RedisLedgerConfig {
        @Bean
        @ConditionalOnBean(StringRedisTemplate.class)
        @ConditionalOnMissingBean(LedgerStore.class)
        LedgerStore ledgerStore(StringRedisTemplate redis,
                                ObjectProvider<ObjectMapper> mapper,
                                Clock clock,
                                OlcLedgerProperties props) {
            return new RedisLedgerStore(redis, mapper.getIfAvailable(ObjectMapper::new), clock, props.getKeyPrefix());
        }
    }

    @Configuration
    @ConditionalOnExpression("'${olc.ledger.store:auto}'.toLowerCase() != 'redis'")
    static class MemoryLedgerConfig {
        @Bean
        @ConditionalOnMissingBean(LedgerStore.class)
        LedgerStore ledgerStore(Clock clock) {
            return new InMemoryLedgerStore(clock);
        }
    }

    // ---------------- ledgers ----------------

    @Bean
    @ConditionalOnMissingBean
    public OrderEventLedger orderEventLedger(LedgerStore store,
                                             ObjectProvider<ObjectMapper> mapper,
                                             Clock clock,
                                             OlcLedgerProperties props) {
        return new OrderEventLedger(store, mapper.getIfAvailable(ObjectMapper::new), clock,
                props.getOrderEventTtl(), props.getPageSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public TransactionLedger transactionLedger(LedgerStore store, ObjectProvider<ObjectMapper> mapper) {
        return new TransactionLedger(store, mapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean(name = "olcLedgerSchedule")
    public OlcLedgerScheduleValues olcLedgerScheduleValues(OlcLedgerProperties props) {
        return new OlcLedgerScheduleValues(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public LedgerExpirySweeper ledgerExpirySweeper(OlcLedgerProperties props,
                                                   LedgerStore store,
                                                   Clock clock,
                                                   ObjectProvider<LedgerExpiryListener> listeners) {
        return new LedgerExpirySweeper(props, store, clock, listeners.orderedStream().collect(Collectors.toList()));
    }

    @Configuration
    @EnableScheduling
    @ConditionalOnProperty(prefix = "olc.ledger.sweeper", name = "scheduling-enabled", havingValue = "true", matchIfMissing = true)
    static class SchedulingConfig {}
}
