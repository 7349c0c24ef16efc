package com.dagrun.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for DAG run events.
 * <p>
 * A listener either follows one run, chosen by the id handed to
 * {@code Scheduler.run(dag, options, runId)}, or every run. Delivery happens synchronously on
 * the publishing thread, in registration order; a listener that throws is logged and skipped.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Null runId means the listener follows every run. */
    private record Listener(String runId, Consumer<DagEvent> consumer) {
        boolean accepts(DagEvent event) {
            return runId == null || runId.equals(event.runId());
        }
    }

    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    public void publish(DagEvent event) {
        log.debug("Publishing {} for run {}", event.eventType(), event.runId());
        for (Listener listener : listeners) {
            if (listener.accepts(event)) {
                deliver(listener, event);
            }
        }
    }

    /**
     * Follows the events of one run. Subscribe before starting the run to see all of them.
     *
     * @throws IllegalArgumentException if {@code runId} is blank
     */
    public Subscription subscribe(String runId, Consumer<DagEvent> consumer) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank; use subscribeAll for every run");
        }
        return register(new Listener(runId, consumer));
    }

    public Subscription subscribeAll(Consumer<DagEvent> consumer) {
        return register(new Listener(null, consumer));
    }

    /** Handle for cancelling a subscription. */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription register(Listener listener) {
        listeners.add(listener);
        log.debug("Listener registered for {}", listener.runId() == null ? "all runs" : "run " + listener.runId());
        // identity removal: two subscriptions of the same consumer stay independent
        return () -> listeners.removeIf(l -> l == listener);
    }

    private void deliver(Listener listener, DagEvent event) {
        try {
            listener.consumer().accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for task {}: {}", event.eventType(), event.task(), e.getMessage(), e);
        }
    }
}
