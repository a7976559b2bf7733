package com.stratasystems.persistence.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Observer registry for {@link PersistenceEvent}s.
 *
 * <p>Events are delivered on a single daemon thread in publish order. A listener that
 * throws is logged and does not affect other listeners or the publisher.
 */
public class PersistenceEventBus implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PersistenceEventBus.class);

    private final Map<PersistenceEventType, List<PersistenceEventListener>> listeners =
        new EnumMap<>(PersistenceEventType.class);
    private final List<PersistenceEventListener> wildcardListeners = new CopyOnWriteArrayList<>();
    private final ExecutorService dispatcher;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public PersistenceEventBus() {
        this.dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "persistence-events");
            t.setDaemon(true);
            return t;
        });
        for (PersistenceEventType type : PersistenceEventType.values()) {
            listeners.put(type, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * Registers a listener for one event type.
     *
     * @return a handle that removes the listener when run
     */
    public Runnable subscribe(PersistenceEventType type, PersistenceEventListener listener) {
        List<PersistenceEventListener> registered = listeners.get(type);
        registered.add(listener);
        return () -> registered.remove(listener);
    }

    /**
     * Registers a listener for every event type.
     *
     * @return a handle that removes the listener when run
     */
    public Runnable subscribeAll(PersistenceEventListener listener) {
        wildcardListeners.add(listener);
        return () -> wildcardListeners.remove(listener);
    }

    public void publish(PersistenceEventType type, Map<String, ?> attributes) {
        publish(new PersistenceEvent(type, attributes));
    }

    public void publish(PersistenceEvent event) {
        if (closed.get()) {
            logger.debug("Event bus closed, dropping {}", event);
            return;
        }
        try {
            dispatcher.execute(() -> dispatch(event));
        } catch (RejectedExecutionException e) {
            logger.debug("Event bus shutting down, dropping {}", event);
        }
    }

    private void dispatch(PersistenceEvent event) {
        for (PersistenceEventListener listener : listeners.get(event.getType())) {
            deliver(listener, event);
        }
        for (PersistenceEventListener listener : wildcardListeners) {
            deliver(listener, event);
        }
    }

    private void deliver(PersistenceEventListener listener, PersistenceEvent event) {
        try {
            listener.onEvent(event);
        } catch (Exception e) {
            logger.error("Event listener failed for {}", event.getType().topic(), e);
        }
    }

    /**
     * Stops dispatching, letting already published events finish.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
