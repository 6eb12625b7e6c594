package com.ashby.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for acquisition and process lifecycle events.
 * <p>
 * Supports per-event-type subscriptions and global subscriptions that receive all events.
 * Delivery is synchronous on the publishing thread; a failing subscriber never affects the
 * publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Subscribers keyed by event type. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AshbyEvent>>> typeSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive every event. */
    private final CopyOnWriteArrayList<Consumer<AshbyEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (type-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(AshbyEvent event) {
        log.debug("Publishing event: {} for {}", event.eventType(), event.subject());

        List<Consumer<AshbyEvent>> subs = typeSubscribers.get(event.eventType());
        if (subs != null) {
            for (Consumer<AshbyEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<AshbyEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of a single type.
     *
     * @param eventType the event type to subscribe to
     * @param consumer  callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String eventType, Consumer<AshbyEvent> consumer) {
        typeSubscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to {}", eventType);
        return () -> {
            CopyOnWriteArrayList<Consumer<AshbyEvent>> subs = typeSubscribers.get(eventType);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to every event regardless of type.
     */
    public Subscription subscribeAll(Consumer<AshbyEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<AshbyEvent> subscriber, AshbyEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
