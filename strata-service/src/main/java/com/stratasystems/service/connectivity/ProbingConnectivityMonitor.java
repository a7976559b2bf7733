package com.stratasystems.service.connectivity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Derives connectivity from a periodic probe, typically a cheap read against the remote tier.
 *
 * <p>A probe that fails, completes with false or does not finish within one interval counts
 * as offline.
 */
public class ProbingConnectivityMonitor extends AbstractConnectivityMonitor {
    private static final Logger logger = LoggerFactory.getLogger(ProbingConnectivityMonitor.class);

    private final Supplier<CompletableFuture<Boolean>> probe;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public ProbingConnectivityMonitor(Supplier<CompletableFuture<Boolean>> probe, Duration interval) {
        super(true);
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Probe interval must be positive");
        }
        this.probe = probe;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "connectivity-probe");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void start() {
        if (started.getAndSet(true)) {
            return;
        }
        long periodMs = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::probeNow, 0, periodMs, TimeUnit.MILLISECONDS);
        logger.info("Connectivity probe started with interval {}", interval);
    }

    /**
     * Runs one probe and waits for its outcome.
     *
     * @return the observed state
     */
    public boolean probeNow() {
        boolean reachable;
        try {
            reachable = Boolean.TRUE.equals(probe.get().get(interval.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return isOnline();
        } catch (TimeoutException e) {
            logger.debug("Connectivity probe timed out");
            reachable = false;
        } catch (Exception e) {
            logger.debug("Connectivity probe failed: {}", e.getMessage());
            reachable = false;
        }
        update(reachable);
        return reachable;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
