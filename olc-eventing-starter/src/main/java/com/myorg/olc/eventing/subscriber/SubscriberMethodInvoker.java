package com.myorg.olc.eventing.subscriber;

import com.myorg.olc.contracts.core.envelope.EventEnvelope;
import com.myorg.olc.contracts.order.OrderEvent;
import lombok.Getter;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

@Getter
public class SubscriberMethodInvoker {
    private final Object target;
    private final Method method;

    public SubscriberMethodInvoker(Object target, Method method) {
        Class<?>[] params = method.getParameterTypes();
        boolean ok = (params.length == 1 && params[0] == OrderEvent.class)
                || (params.length == 2 && params[0] == EventEnvelope.class && params[1] == OrderEvent.class);
        if (!ok) {
            throw new IllegalStateException("Subscriber method must take (OrderEvent) or (EventEnvelope, OrderEvent): " + method);
        }
        ReflectionUtils.makeAccessible(method);
        this.target = target;
        this.method = method;
    }

    /**
     * Exceptions thrown by the subscriber propagate unwrapped.
     */
    public void invoke(EventEnvelope env, OrderEvent event) throws Exception {
        try {
            if (method.getParameterCount() == 1) {
                method.invoke(target, event);
            } else {
                method.invoke(target, env, event);
            }
        } catch (InvocationTargetException e) {
            Throwable cause = e.getTargetException();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw e;
        }
    }

    @Override
    public String toString() {
        return method.getDeclaringClass().getSimpleName() + "#" + method.getName();
    }
}
