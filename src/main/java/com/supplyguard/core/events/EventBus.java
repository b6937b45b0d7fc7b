package com.supplyguard.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process pub/sub for conversation thread events.
 * Subscribers either follow one thread or all of them; a subscriber that throws
 * is logged and does not affect delivery to the others.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<RiskEvent>>> threadSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<RiskEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    public void publish(RiskEvent event) {
        log.debug("Event {} on thread {}", event.eventType(), event.threadId());
        List<Consumer<RiskEvent>> subs = threadSubscribers.get(event.threadId());
        if (subs != null) {
            subs.forEach(s -> deliverSafely(s, event));
        }
        globalSubscribers.forEach(s -> deliverSafely(s, event));
    }

    public Subscription subscribe(String threadId, Consumer<RiskEvent> consumer) {
        threadSubscribers.computeIfAbsent(threadId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            var subs = threadSubscribers.get(threadId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    threadSubscribers.remove(threadId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<RiskEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<RiskEvent> subscriber, RiskEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on event {}: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
