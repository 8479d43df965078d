package com.myorg.olc.connection.autoconfig;

import com.myorg.olc.connection.ConnectionPusher;
import com.myorg.olc.connection.ConnectionRegistry;
import com.myorg.olc.connection.gateway.ChannelGateway;
import com.myorg.olc.connection.gateway.ChannelRelay;
import com.myorg.olc.connection.gateway.RedisChannelRelay;
import com.myorg.olc.connection.gateway.WebSocketSessionGateway;
import com.myorg.olc.ledger.autoconfig.OlcLedgerAutoConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class OlcConnectionAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(OlcLedgerAutoConfiguration.class, OlcConnectionAutoConfiguration.class))
            .withPropertyValues("olc.ledger.store=memory", "olc.ledger.sweeper.scheduling-enabled=false");

    @Test
    void defaultsToWebSocketGateway() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(ConnectionPusher.class);
            assertThat(ctx.getBean(ChannelGateway.class)).isInstanceOf(WebSocketSessionGateway.class);
        });
    }

    @Test
    void customGatewayWins() {
        runner.withBean(ChannelGateway.class, () -> (id, payload) -> { })
                .run(ctx -> {
                    assertThat(ctx).doesNotHaveBean(WebSocketSessionGateway.class);
                    assertThat(ctx).hasSingleBean(ConnectionPusher.class);
                });
    }

    @Test
    void instanceIdFromPropertyIsRecordedOnConnections() {
        runner.withPropertyValues("olc.connection.instance-id=node-1")
                .run(ctx -> {
                    ConnectionRegistry registry = ctx.getBean(ConnectionRegistry.class);
                    assertThat(registry.instanceId()).isEqualTo("node-1");
                    assertThat(registry.onConnect("c1").instanceId()).isEqualTo("node-1");
                });
    }

    @Test
    void noRedisRelayWithoutRedis() {
        runner.run(ctx -> {
            assertThat(ctx).doesNotHaveBean(RedisChannelRelay.class);
            assertThat(ctx).doesNotHaveBean(ChannelRelay.class);
            assertThat(ctx.getBean(ConnectionRegistry.class).instanceId()).isNotBlank();
        });
    }
}
