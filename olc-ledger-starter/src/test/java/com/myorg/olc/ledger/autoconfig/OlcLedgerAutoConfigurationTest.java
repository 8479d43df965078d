package com.myorg.olc.ledger.autoconfig;

import com.myorg.olc.ledger.expiry.LedgerExpirySweeper;
import com.myorg.olc.ledger.order.OrderEventLedger;
import com.myorg.olc.ledger.store.InMemoryLedgerStore;
import com.myorg.olc.ledger.store.LedgerStore;
import com.myorg.olc.ledger.transaction.TransactionLedger;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class OlcLedgerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(OlcLedgerAutoConfiguration.class))
            .withPropertyValues("olc.ledger.sweeper.scheduling-enabled=false");

    @Test
    void autoFallsBackToMemoryWithoutRedisTemplate() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(LedgerStore.class);
            assertThat(ctx.getBean(LedgerStore.class)).isInstanceOf(InMemoryLedgerStore.class);
            assertThat(ctx).hasSingleBean(OrderEventLedger.class);
            assertThat(ctx).hasSingleBean(TransactionLedger.class);
            assertThat(ctx).hasSingleBean(LedgerExpirySweeper.class);
        });
    }

    @Test
    void redisStoreWithoutRedisTemplateFailsStartup() {
        runner.withPropertyValues("olc.ledger.store=redis")
                .run(ctx -> assertThat(ctx).hasFailed());
    }
}
