package org.carma.liquidity.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Event bus for simulation events.
 *
 * Provides:
 * - Type-safe subscription
 * - Synchronous event dispatch
 * - Event history for audit trail
 *
 * A failing handler is logged and skipped; it never aborts the run.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<Class<? extends SimulationEvent>, List<Consumer<SimulationEvent>>> subscribers;
    private final List<SimulationEvent> eventHistory;
    private final boolean recordHistory;

    public EventBus() {
        this(true);
    }

    public EventBus(boolean recordHistory) {
        this.subscribers = new ConcurrentHashMap<>();
        this.eventHistory = Collections.synchronizedList(new ArrayList<>());
        this.recordHistory = recordHistory;
    }

    // ========================================================================
    // Subscription
    // ========================================================================

    /**
     * Subscribe to a specific event type.
     */
    @SuppressWarnings("unchecked")
    public <T extends SimulationEvent> void subscribe(Class<T> eventType, Consumer<T> handler) {
        subscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
            .add(event -> handler.accept((T) event));
    }

    /**
     * Subscribe to all events.
     */
    public void subscribeAll(Consumer<SimulationEvent> handler) {
        subscribe(SimulationEvent.DayStarted.class, handler::accept);
        subscribe(SimulationEvent.AgentReacted.class, handler::accept);
        subscribe(SimulationEvent.RepoRefused.class, handler::accept);
        subscribe(SimulationEvent.SellingAbsorbed.class, handler::accept);
        subscribe(SimulationEvent.DayCompleted.class, handler::accept);
    }

    // ========================================================================
    // Publishing
    // ========================================================================

    /**
     * Publish an event to all subscribers of its type.
     */
    public void publish(SimulationEvent event) {
        if (recordHistory) {
            eventHistory.add(event);
        }

        List<Consumer<SimulationEvent>> handlers = subscribers.get(event.getClass());
        if (handlers != null) {
            for (Consumer<SimulationEvent> handler : handlers) {
                try {
                    handler.accept(event);
                } catch (RuntimeException e) {
                    log.warn("Handler for {} on day {} failed: {}", event.eventType(), event.day(), e.getMessage(), e);
                }
            }
        }
    }

    // ========================================================================
    // History Management
    // ========================================================================

    public List<SimulationEvent> getHistory() {
        synchronized (eventHistory) {
            return new ArrayList<>(eventHistory);
        }
    }

    /**
     * Get events of a specific type.
     */
    public <T extends SimulationEvent> List<T> getHistory(Class<T> eventType) {
        List<T> filtered = new ArrayList<>();
        for (SimulationEvent event : getHistory()) {
            if (eventType.isInstance(event)) {
                filtered.add(eventType.cast(event));
            }
        }
        return filtered;
    }

    public int getEventCount() {
        return eventHistory.size();
    }

    public int getEventCount(Class<? extends SimulationEvent> eventType) {
        return (int) getHistory().stream()
            .filter(eventType::isInstance)
            .count();
    }

    public void clearHistory() {
        eventHistory.clear();
    }

    public void clearSubscribers() {
        subscribers.clear();
    }

    @Override
    public String toString() {
        return String.format("EventBus[subscribers=%d, history=%d events]",
            subscribers.values().stream().mapToInt(List::size).sum(),
            eventHistory.size());
    }
}
