package com.stratasystems.service.connectivity;

import java.util.function.Consumer;

/**
 * Source of online/offline transitions for the persistence service.
 */
public interface ConnectivityMonitor extends AutoCloseable {

    boolean isOnline();

    /**
     * Registers a listener called with the new state on every transition.
     *
     * @return a handle that unregisters the listener
     */
    Runnable addListener(Consumer<Boolean> listener);

    void start();

    @Override
    void close();
}
