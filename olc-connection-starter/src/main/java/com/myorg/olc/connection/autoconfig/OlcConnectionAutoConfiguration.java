package com.myorg.olc.connection.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.connection.ConnectionMetrics;
import com.myorg.olc.connection.ConnectionPusher;
import com.myorg.olc.connection.ConnectionRegistry;
import com.myorg.olc.connection.gateway.ChannelGateway;
import com.myorg.olc.connection.gateway.ChannelRelay;
import com.myorg.olc.connection.gateway.ConnectionWebSocketHandler;
import com.myorg.olc.connection.gateway.RedisChannelRelay;
import com.myorg.olc.connection.gateway.WebSocketSessionGateway;
import com.myorg.olc.connection.route.ChannelRouteHandler;
import com.myorg.olc.connection.route.ChannelRouter;
import com.myorg.olc.ledger.store.LedgerStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.time.Clock;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@AutoConfiguration(afterName = {
        "com.myorg.olc.ledger.autoconfig.OlcLedgerAutoConfiguration",
        "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@EnableConfigurationProperties(OlcConnectionProperties.class)
@ConditionalOnProperty(prefix = "olc.connection", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OlcConnectionAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ConnectionRegistry connectionRegistry(LedgerStore store,
                                                 OlcConnectionProperties props,
                                                 ObjectProvider<ObjectMapper> mapper,
                                                 ObjectProvider<Clock> clock) {
        String instanceId = StringUtils.hasText(props.getInstanceId())
                ? props.getInstanceId()
                : UUID.randomUUID().toString();
        log.info("Connection registry instanceId={}", instanceId);
        return new ConnectionRegistry(store, mapper.getIfAvailable(ObjectMapper::new),
                clock.getIfAvailable(Clock::systemUTC), instanceId);
    }

    @Bean
    @ConditionalOnMissingBean(ChannelGateway.class)
    public WebSocketSessionGateway webSocketSessionGateway() {
        return new WebSocketSessionGateway();
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "olc.connection", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public ConnectionMetrics connectionMetrics(MeterRegistry registry) {
        ConnectionMetrics m = new ConnectionMetrics(registry);
        m.preRegister();
        return m;
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectionPusher connectionPusher(ConnectionRegistry registry,
                                             ChannelGateway gateway,
                                             ObjectProvider<ObjectMapper> mapper,
                                             ObjectProvider<ConnectionMetrics> metrics,
                                             ObjectProvider<ChannelRelay> relay) {
        return new ConnectionPusher(registry, gateway, mapper.getIfAvailable(ObjectMapper::new),
                metrics.getIfAvailable(), relay.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public ChannelRouter channelRouter(ObjectProvider<ChannelRouteHandler> handlers) {
        ChannelRouter router = new ChannelRouter(handlers.orderedStream().collect(Collectors.toList()));
        log.info("Channel routes: {}", router.actions());
        return router;
    }

    @Configuration
    @ConditionalOnClass(StringRedisTemplate.class)
    @ConditionalOnProperty(prefix = "olc.connection.relay", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class RedisRelayConfig {

        @Bean
        @ConditionalOnBean(StringRedisTemplate.class)
        @ConditionalOnMissingBean(ChannelRelay.class)
        RedisChannelRelay redisChannelRelay(StringRedisTemplate redis,
                                            OlcConnectionProperties props,
                                            ChannelGateway gateway,
                                            ConnectionRegistry registry,
                                            ObjectProvider<ObjectMapper> mapper) {
            return new RedisChannelRelay(redis, mapper.getIfAvailable(ObjectMapper::new), gateway, registry,
                    props.getRelay().getChannelPrefix());
        }

        @Bean
        @ConditionalOnBean(RedisChannelRelay.class)
        @ConditionalOnMissingBean(name = "olcConnectionRelayListenerContainer")
        RedisMessageListenerContainer olcConnectionRelayListenerContainer(RedisConnectionFactory factory,
                                                                          RedisChannelRelay relay) {
            RedisMessageListenerContainer container = new RedisMessageListenerContainer();
            container.setConnectionFactory(factory);
            container.addMessageListener(relay, relay.localTopic());
            log.info("Connection relay listening channel={}", relay.localTopic().getTopic());
            return container;
        }
    }

    @Configuration
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(WebSocketConfigurer.class)
    @ConditionalOnBean(WebSocketSessionGateway.class)
    @ConditionalOnProperty(prefix = "olc.connection.websocket", name = "enabled", havingValue = "true", matchIfMissing = true)
    @EnableWebSocket
    @RequiredArgsConstructor
    static class WebSocketConfig implements WebSocketConfigurer {

        private final OlcConnectionProperties props;
        private final ConnectionRegistry registry;
        private final WebSocketSessionGateway gateway;
        private final ChannelRouter router;
        private final ObjectProvider<ObjectMapper> mapper;

        @Override
        public void registerWebSocketHandlers(WebSocketHandlerRegistry handlers) {
            var handler = new ConnectionWebSocketHandler(registry, gateway, router, mapper.getIfAvailable(ObjectMapper::new));
            handlers.addHandler(handler, props.getWebsocket().getPath())
                    .setAllowedOrigins(props.getWebsocket().getAllowedOrigins().toArray(String[]::new));
            log.info("Websocket endpoint registered path={}", props.getWebsocket().getPath());
        }
    }
}
