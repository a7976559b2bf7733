package com.stratasystems.service.connectivity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Holds the current state and notifies listeners on transitions only.
 */
public abstract class AbstractConnectivityMonitor implements ConnectivityMonitor {
    private static final Logger logger = LoggerFactory.getLogger(AbstractConnectivityMonitor.class);

    private final List<Consumer<Boolean>> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean online;

    protected AbstractConnectivityMonitor(boolean initiallyOnline) {
        this.online = initiallyOnline;
    }

    @Override
    public boolean isOnline() {
        return online;
    }

    @Override
    public Runnable addListener(Consumer<Boolean> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Records the observed state, notifying listeners if it changed.
     */
    protected void update(boolean nowOnline) {
        synchronized (this) {
            if (online == nowOnline) {
                return;
            }
            online = nowOnline;
        }
        logger.info("Connectivity changed: {}", nowOnline ? "online" : "offline");
        for (Consumer<Boolean> listener : listeners) {
            try {
                listener.accept(nowOnline);
            } catch (Exception e) {
                logger.error("Connectivity listener failed", e);
            }
        }
    }
}
