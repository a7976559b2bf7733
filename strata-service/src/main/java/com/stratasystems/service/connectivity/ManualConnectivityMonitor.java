package com.stratasystems.service.connectivity;

/**
 * Connectivity driven by explicit calls, for embedders that learn about the network from
 * elsewhere (and for tests).
 */
public class ManualConnectivityMonitor extends AbstractConnectivityMonitor {

    public ManualConnectivityMonitor() {
        this(true);
    }

    public ManualConnectivityMonitor(boolean initiallyOnline) {
        super(initiallyOnline);
    }

    public void setOnline(boolean online) {
        update(online);
    }

    @Override
    public void start() {
    }

    @Override
    public void close() {
    }
}
