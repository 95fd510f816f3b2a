package com.tasklane.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for run execution events.
 * <p>
 * Supports per-run subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-run subscribers keyed by runId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<EngineEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all runs. */
    private final CopyOnWriteArrayList<Consumer<EngineEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (run-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(EngineEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.runId());

        List<Consumer<EngineEvent>> runSubs = event.runId() != null ? runSubscribers.get(event.runId()) : null;
        if (runSubs != null) {
            for (Consumer<EngineEvent> subscriber : runSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<EngineEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public void publish(String eventType, String runId, String taskId, Map<String, Object> payload) {
        publish(new EngineEvent(eventType, runId, taskId, payload, Instant.now()));
    }

    /**
     * Subscribe to events for a specific run.
     *
     * @param runId    the run to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<EngineEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to run {}", runId);
        return () -> {
            CopyOnWriteArrayList<Consumer<EngineEvent>> subs = runSubscribers.get(runId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    runSubscribers.remove(runId, subs);
                }
            }
        };
    }

    /**
     * Subscribe to events from all runs (global subscription).
     *
     * @param consumer callback invoked for each event regardless of run
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<EngineEvent> consumer) {
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

    private void deliverSafely(Consumer<EngineEvent> subscriber, EngineEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
