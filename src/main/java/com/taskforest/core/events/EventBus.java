package com.taskforest.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for reconstruction audit events.
 * <p>
 * Supports per-run subscriptions, global subscriptions that receive all events,
 * and global subscriptions narrowed to event types. A type pattern is either an
 * exact type ({@code "edge.resolved"}) or a family wildcard ({@code "edge.*"}).
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-run subscribers keyed by runId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ReconstructionEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all runs. */
    private final CopyOnWriteArrayList<Consumer<ReconstructionEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (run-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(ReconstructionEvent event) {
        log.trace("Publishing event: {} for run {} task {}", event.eventType(), event.runId(), event.taskId());

        List<Consumer<ReconstructionEvent>> runSubs = runSubscribers.get(event.runId());
        if (runSubs != null) {
            for (Consumer<ReconstructionEvent> subscriber : runSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<ReconstructionEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific run.
     *
     * @param runId    the run to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<ReconstructionEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to run {}", runId);
        return () -> runSubscribers.computeIfPresent(runId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * Subscribe to events from all runs.
     *
     * @param consumer callback invoked for each event regardless of run
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<ReconstructionEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Subscribe to events from all runs whose type matches one of the patterns.
     *
     * @param typePatterns exact event types or {@code family.*} wildcards
     * @param consumer     callback invoked for each matching event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeTypes(Collection<String> typePatterns, Consumer<ReconstructionEvent> consumer) {
        if (typePatterns.isEmpty()) {
            throw new IllegalArgumentException("At least one event type pattern is required");
        }
        Set<String> patterns = Set.copyOf(typePatterns);
        log.debug("Subscribed to event types {}", patterns);
        return subscribeAll(event -> {
            if (matchesAny(patterns, event.eventType())) {
                consumer.accept(event);
            }
        });
    }

    static boolean matchesAny(Set<String> patterns, String eventType) {
        if (eventType == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (pattern.endsWith(".*")
                    ? eventType.startsWith(pattern.substring(0, pattern.length() - 1))
                    : pattern.equals(eventType)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ReconstructionEvent> subscriber, ReconstructionEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
