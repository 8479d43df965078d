package com.myorg.olc.eventing.subscriber;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.framework.AopProxyUtils;
import org.springframework.aop.support.AopUtils;
import org.springframework.context.ApplicationContext;
import org.springframework.core.MethodIntrospector;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.Map;

/**
 * Registers every {@link OrderEventSubscriber} method of the context's components.
 * Annotations are read from the ultimate target class so proxied beans are found too.
 */
@Slf4j
public class SubscriberScanner {

    private final SubscriberRegistry registry;

    public SubscriberScanner(SubscriberRegistry registry) {
        this.registry = registry;
    }

    public int scan(ApplicationContext ctx) {
        int found = 0;
        Map<String, Object> beans = ctx.getBeansWithAnnotation(Component.class);
        for (Object bean : beans.values()) {
            found += scanBean(bean);
        }
        return found;
    }

    public int scanBean(Object bean) {
        Class<?> targetClass = AopProxyUtils.ultimateTargetClass(bean);

        Map<Method, OrderEventSubscriber> methods = MethodIntrospector.selectMethods(
                targetClass,
                (Method m) -> AnnotatedElementUtils.findMergedAnnotation(m, OrderEventSubscriber.class)
        );

        methods.forEach((method, ann) -> {
            // the method to call must be the one on the proxy class
            Method invocable = AopUtils.selectInvocableMethod(method, bean.getClass());
            registry.register(ann.value(), new SubscriberMethodInvoker(bean, invocable));
            log.info("Order event subscriber registered subscription={} method={}#{}",
                    ann.value(), targetClass.getSimpleName(), method.getName());
        });
        return methods.size();
    }
}
