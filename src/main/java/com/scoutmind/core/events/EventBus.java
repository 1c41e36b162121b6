package com.scoutmind.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for research run events, scoped per run.
 * <p>
 * A run's subscriber list lives until the run's terminal event
 * ({@code run.completed}, {@code run.failed} or {@code run.cancelled}) has been
 * delivered, after which it is dropped. A subscriber that throws never affects
 * the publisher or the other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ResearchEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    /**
     * Delivers the event to the run's subscribers in subscription order.
     */
    public void publish(ResearchEvent event) {
        log.debug("Publishing {} for run {}", event.eventType(), event.runId());

        List<Consumer<ResearchEvent>> subscribers = runSubscribers.get(event.runId());
        if (subscribers != null) {
            for (Consumer<ResearchEvent> subscriber : subscribers) {
                deliverSafely(subscriber, event);
            }
        }
        if (event.isTerminal() && runSubscribers.remove(event.runId()) != null) {
            log.debug("Run {} ended with {}, subscribers released", event.runId(), event.eventType());
        }
    }

    /**
     * Subscribe to events for a specific run.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<ResearchEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to run {}", runId);
        return () -> runSubscribers.computeIfPresent(runId, (id, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * Drops every subscriber of a run that ended without a terminal event.
     */
    public void clearRun(String runId) {
        runSubscribers.remove(runId);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ResearchEvent> subscriber, ResearchEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber for run {} failed on {}: {}",
                    event.runId(), event.eventType(), e.getMessage(), e);
        }
    }
}
