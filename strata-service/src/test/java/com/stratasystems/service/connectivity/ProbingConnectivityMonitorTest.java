package com.stratasystems.service.connectivity;

import com.stratasystems.test.AsyncAssertion;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ProbingConnectivityMonitorTest {

    @Test
    void testProbeOutcomeDrivesState() {
        AtomicBoolean reachable = new AtomicBoolean(false);
        ProbingConnectivityMonitor monitor = new ProbingConnectivityMonitor(
            () -> CompletableFuture.completedFuture(reachable.get()), Duration.ofSeconds(1));

        assertFalse(monitor.probeNow());
        assertFalse(monitor.isOnline());

        reachable.set(true);
        assertTrue(monitor.probeNow());
        assertTrue(monitor.isOnline());
        monitor.close();
    }

    @Test
    void testFailedOrHungProbeMeansOffline() {
        ProbingConnectivityMonitor failing = new ProbingConnectivityMonitor(
            () -> CompletableFuture.failedFuture(new IllegalStateException("refused")), Duration.ofSeconds(1));
        assertFalse(failing.probeNow());
        failing.close();

        ProbingConnectivityMonitor hung = new ProbingConnectivityMonitor(
            CompletableFuture::new, Duration.ofMillis(50));
        assertFalse(hung.probeNow());
        hung.close();
    }

    @Test
    void testScheduledProbesNotifyListeners() {
        AtomicBoolean reachable = new AtomicBoolean(true);
        List<Boolean> seen = new CopyOnWriteArrayList<>();
        ProbingConnectivityMonitor monitor = new ProbingConnectivityMonitor(
            () -> CompletableFuture.completedFuture(reachable.get()), Duration.ofMillis(20));
        monitor.addListener(seen::add);
        monitor.start();
        try {
            reachable.set(false);
            AsyncAssertion.eventually(() -> seen.contains(false), Duration.ofSeconds(2));
            reachable.set(true);
            AsyncAssertion.eventually(() -> seen.contains(true), Duration.ofSeconds(2));
        } finally {
            monitor.close();
        }
        assertEquals(List.of(false, true), seen.subList(0, 2));
    }
}
