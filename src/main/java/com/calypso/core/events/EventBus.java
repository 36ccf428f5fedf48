package com.calypso.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for build progress events.
 * <p>
 * Subscribers register per build id. Delivery happens synchronously on the
 * publishing (build worker) thread, so a subscriber must not block. A failing
 * subscriber never breaks the build: its exception is logged and swallowed.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<BuildEvent>>> buildSubscribers =
            new ConcurrentHashMap<>();

    /**
     * Publish an event to every subscriber of its build.
     *
     * @param event the event to publish
     */
    public void publish(BuildEvent event) {
        log.debug("Publishing event: {} for build {}", event.eventType(), event.buildId());

        List<Consumer<BuildEvent>> subs = buildSubscribers.get(event.buildId());
        if (subs != null) {
            for (Consumer<BuildEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
    }

    /**
     * Subscribe to events for a specific build.
     *
     * @param buildId  the build to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String buildId, Consumer<BuildEvent> consumer) {
        buildSubscribers.computeIfAbsent(buildId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to build {}", buildId);
        return () -> {
            CopyOnWriteArrayList<Consumer<BuildEvent>> subs = buildSubscribers.get(buildId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    buildSubscribers.remove(buildId, subs);
                }
            }
        };
    }

    public int subscriberCount(String buildId) {
        List<Consumer<BuildEvent>> subs = buildSubscribers.get(buildId);
        return subs == null ? 0 : subs.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<BuildEvent> subscriber, BuildEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
