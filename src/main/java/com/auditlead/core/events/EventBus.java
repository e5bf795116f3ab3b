package com.auditlead.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for one audit run.
 * <p>
 * Supports per-type subscriptions and global subscriptions that receive every event.
 * Each published event is appended to a bounded history first, then delivered to all
 * matching subscribers concurrently; {@link #publish} returns once every subscriber has
 * been invoked. A subscriber that throws is logged and does not affect the others.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final int DEFAULT_HISTORY_LIMIT = 10_000;

    /** Per-type subscribers. */
    private final Map<EventType, CopyOnWriteArrayList<Consumer<AuditEvent>>> typeSubscribers =
            new EnumMap<>(EventType.class);

    /** Global subscribers that receive events of every type. */
    private final CopyOnWriteArrayList<Consumer<AuditEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    private final Deque<AuditEvent> history = new ArrayDeque<>();
    private final Object historyLock = new Object();
    private final int historyLimit;
    private final Executor deliveryExecutor;

    public EventBus() {
        this(ForkJoinPool.commonPool(), DEFAULT_HISTORY_LIMIT);
    }

    public EventBus(Executor deliveryExecutor, int historyLimit) {
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be positive: " + historyLimit);
        }
        this.deliveryExecutor = deliveryExecutor;
        this.historyLimit = historyLimit;
        for (EventType type : EventType.values()) {
            typeSubscribers.put(type, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * Publish an event: record it in history, then deliver it to all matching subscribers.
     *
     * @param event the event to publish
     */
    public void publish(AuditEvent event) {
        log.debug("Publishing {} from {} for run {}", event.eventType(), event.sender(), event.runId());

        synchronized (historyLock) {
            history.addLast(event);
            if (history.size() > historyLimit) {
                history.removeFirst();
            }
        }

        List<Consumer<AuditEvent>> targets = new ArrayList<>(typeSubscribers.get(event.eventType()));
        targets.addAll(globalSubscribers);
        if (targets.isEmpty()) {
            return;
        }
        if (targets.size() == 1) {
            deliverSafely(targets.get(0), event);
            return;
        }

        var deliveries = new ArrayList<CompletableFuture<Void>>(targets.size());
        for (Consumer<AuditEvent> subscriber : targets) {
            try {
                deliveries.add(CompletableFuture.runAsync(() -> deliverSafely(subscriber, event), deliveryExecutor));
            } catch (RejectedExecutionException e) {
                deliverSafely(subscriber, event);
            }
        }
        CompletableFuture.allOf(deliveries.toArray(new CompletableFuture[0])).join();
    }

    /**
     * Subscribe to events of one type.
     *
     * @param eventType the type to receive
     * @param consumer  callback invoked for each future event of that type
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(EventType eventType, Consumer<AuditEvent> consumer) {
        CopyOnWriteArrayList<Consumer<AuditEvent>> subs = typeSubscribers.get(eventType);
        subs.add(consumer);
        log.debug("Subscribed to {}", eventType);
        return () -> subs.remove(consumer);
    }

    /**
     * Subscribe to events of every type.
     *
     * @param consumer callback invoked for each future event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<AuditEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Ordered snapshot of the events published so far, optionally filtered.
     *
     * @param sender    only events from this agent, or {@code null} for any
     * @param eventType only events of this type, or {@code null} for any
     */
    public List<AuditEvent> history(String sender, EventType eventType) {
        synchronized (historyLock) {
            return history.stream()
                    .filter(e -> sender == null || sender.equals(e.sender()))
                    .filter(e -> eventType == null || eventType == e.eventType())
                    .toList();
        }
    }

    public List<AuditEvent> history() {
        return history(null, null);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<AuditEvent> subscriber, AuditEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing {} from {}: {}",
                    event.eventType(), event.sender(), e.getMessage(), e);
        }
    }
}
