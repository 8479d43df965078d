package com.myorg.olc.eventing.subscriber;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

// subscription name -> subscriber method
public class SubscriberRegistry {
    private final Map<String, SubscriberMethodInvoker> subscribers = new ConcurrentHashMap<>();

    public void register(String subscription, SubscriberMethodInvoker invoker) {
        SubscriberMethodInvoker prev = subscribers.putIfAbsent(subscription, invoker);
        if (prev != null && !prev.getMethod().equals(invoker.getMethod())) {
            throw new IllegalStateException("Subscription '" + subscription + "' has two subscribers: "
                    + prev + " and " + invoker);
        }
    }

    public SubscriberMethodInvoker get(String subscription) {
        return subscribers.get(subscription);
    }

    public Set<String> names() {
        return Set.copyOf(subscribers.keySet());
    }
}
