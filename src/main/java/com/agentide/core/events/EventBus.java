package com.agentide.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for session events.
 * <p>
 * Supports per-session subscriptions and global subscriptions. A subscriber that throws
 * is logged and skipped; it never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<SessionEvent>>> sessionSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<SessionEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(SessionEvent event) {
        log.debug("Publishing event: {} for session {}", event.eventType(), event.sessionId());

        List<Consumer<SessionEvent>> subs = sessionSubscribers.get(event.sessionId());
        if (subs != null) {
            for (Consumer<SessionEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<SessionEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public Subscription subscribe(String sessionId, Consumer<SessionEvent> consumer) {
        sessionSubscribers.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to session {}", sessionId);
        return () -> {
            CopyOnWriteArrayList<Consumer<SessionEvent>> subs = sessionSubscribers.get(sessionId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    sessionSubscribers.remove(sessionId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<SessionEvent> consumer) {
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

    private void deliverSafely(Consumer<SessionEvent> subscriber, SessionEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
