package com.appforge.core.events;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for generation progress events.
 * <p>
 * Publishing never blocks on subscribers: each event is appended to a bounded
 * per-generation log that callers can poll, then handed to a single dispatcher thread
 * that delivers it to subscribers in publish order.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    static final int HISTORY_LIMIT = 500;

    /** Per-generation subscribers keyed by generationId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<GenerationEvent>>> generationSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all generations. */
    private final CopyOnWriteArrayList<Consumer<GenerationEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /** Most recent events per generation, oldest first. */
    private final ConcurrentHashMap<String, Deque<GenerationEvent>> history = new ConcurrentHashMap<>();

    private final ExecutorService dispatcher = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "appforge-events");
        thread.setDaemon(true);
        return thread;
    });

    /**
     * Publish an event to all matching subscribers (generation-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(GenerationEvent event) {
        log.debug("Publishing event: {} for generation {}", event.eventType(), event.generationId());

        Deque<GenerationEvent> events = history.computeIfAbsent(event.generationId(), k -> new ArrayDeque<>());
        synchronized (events) {
            events.addLast(event);
            if (events.size() > HISTORY_LIMIT) {
                events.removeFirst();
            }
        }

        try {
            dispatcher.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.debug("Event bus shut down, {} kept in history only", event.eventType());
        }
    }

    /**
     * Events recorded for a generation, oldest first.
     */
    public List<GenerationEvent> recentEvents(String generationId) {
        Deque<GenerationEvent> events = history.get(generationId);
        if (events == null) {
            return List.of();
        }
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    /**
     * Subscribe to events for a specific generation.
     *
     * @param generationId the generation to subscribe to
     * @param consumer     callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String generationId, Consumer<GenerationEvent> consumer) {
        generationSubscribers.computeIfAbsent(generationId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to generation {}", generationId);
        return () -> {
            CopyOnWriteArrayList<Consumer<GenerationEvent>> subs = generationSubscribers.get(generationId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events from all generations (global subscription).
     *
     * @param consumer callback invoked for each event regardless of generation
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<GenerationEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    @PreDestroy
    public void shutdown() {
        dispatcher.shutdown();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(GenerationEvent event) {
        List<Consumer<GenerationEvent>> generationSubs = generationSubscribers.get(event.generationId());
        if (generationSubs != null) {
            for (Consumer<GenerationEvent> subscriber : generationSubs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<GenerationEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    private void deliverSafely(Consumer<GenerationEvent> subscriber, GenerationEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
