package com.forgemind.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for registry and evolution events.
 * <p>
 * Supports per-behavior subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-behavior subscribers keyed by behaviorId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ForgeEvent>>> behaviorSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<ForgeEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    /**
     * Publish an event to the behavior's subscribers and to global subscribers.
     * A failing subscriber never affects the publisher or other subscribers.
     */
    public void publish(ForgeEvent event) {
        log.debug("Publishing event: {} for behavior {}", event.eventType(), event.behaviorId());

        List<Consumer<ForgeEvent>> subs = event.behaviorId() != null
                ? behaviorSubscribers.get(event.behaviorId()) : null;
        if (subs != null) {
            for (Consumer<ForgeEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<ForgeEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public Subscription subscribe(String behaviorId, Consumer<ForgeEvent> consumer) {
        behaviorSubscribers.computeIfAbsent(behaviorId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to behavior {}", behaviorId);
        return () -> {
            CopyOnWriteArrayList<Consumer<ForgeEvent>> subs = behaviorSubscribers.get(behaviorId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<ForgeEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ForgeEvent> subscriber, ForgeEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
