package com.myorg.olc.observability;

import com.myorg.olc.eventing.dispatch.OrderEventDispatcher;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(OrderEventDispatcher.class)
@EnableConfigurationProperties(OlcObservabilityProperties.class)
public class OlcObservabilityAutoConfiguration {

    @Bean
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    public OlcMetrics olcMetrics(MeterRegistry registry, Environment env, OlcObservabilityProperties props) {
        String app = env.getProperty("spring.application.name", "unknown-service");
        return new OlcMetrics(registry, app, props);
    }

    @Bean
    public SmartLifecycle olcMetricsPreRegisterLifecycle(OlcObservabilityProperties props,
                                                         ObjectProvider<OlcMetrics> metricsProvider) {
        return new SmartLifecycle() {
            private boolean running = false;

            @Override public void start() {
                if (props.isEnabled() && props.isMetricsEnabled()) {
                    OlcMetrics m = metricsProvider.getIfAvailable();
                    if (m != null) m.preRegisterBaseMeters();
                }
                running = true;
            }

            @Override public void stop() { running = false; }
            @Override public boolean isRunning() { return running; }
            @Override public int getPhase() { return Integer.MIN_VALUE; }
        };
    }

    @Bean
    public static BeanPostProcessor observingOrderEventDispatcherBpp(OlcObservabilityProperties props,
                                                                     ObjectProvider<OlcMetrics> metricsProvider) {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (!props.isEnabled()) return bean;
                if (!(bean instanceof OrderEventDispatcher)) return bean;
                if (bean instanceof ObservingOrderEventDispatcher) return bean;

                return new ObservingOrderEventDispatcher((OrderEventDispatcher) bean, props, metricsProvider.getIfAvailable());
            }
        };
    }
}
