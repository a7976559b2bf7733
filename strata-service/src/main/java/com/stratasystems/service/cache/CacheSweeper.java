package com.stratasystems.service.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background housekeeping that removes expired cache entries on a fixed interval.
 *
 * <p>Reads re-check expiry themselves, so a sweep that is late or skipped never makes the
 * cache return stale data; it only bounds how long dead entries occupy memory.
 */
public class CacheSweeper implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CacheSweeper.class);

    private final RecordCache cache;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong totalSweeps = new AtomicLong(0);
    private final AtomicLong totalRemoved = new AtomicLong(0);

    public CacheSweeper(RecordCache cache, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sweep interval must be positive");
        }
        this.cache = cache;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-sweeper");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (!cache.isEnabled()) {
            logger.info("Cache is disabled, sweeper not started");
            return;
        }
        if (started.getAndSet(true)) {
            logger.warn("Cache sweeper already started");
            return;
        }
        running.set(true);
        long periodMs = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::runSweep, periodMs, periodMs, TimeUnit.MILLISECONDS);
        logger.info("Cache sweeper started with interval {}", interval);
    }

    public void stop() {
        if (!started.get()) {
            scheduler.shutdownNow();
            return;
        }
        running.set(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Cache sweeper stopped after {} sweeps, {} entries removed",
            totalSweeps.get(), totalRemoved.get());
    }

    /**
     * Runs one sweep on the calling thread.
     *
     * @return the number of entries removed
     */
    public int sweepNow() {
        int removed = cache.sweep();
        totalSweeps.incrementAndGet();
        totalRemoved.addAndGet(removed);
        return removed;
    }

    public long getTotalSweeps() {
        return totalSweeps.get();
    }

    public long getTotalRemoved() {
        return totalRemoved.get();
    }

    private void runSweep() {
        if (!running.get()) {
            return;
        }
        try {
            int removed = sweepNow();
            if (removed > 0) {
                logger.info("Cache cleaned: {} expired entries removed", removed);
            }
        } catch (Exception e) {
            logger.error("Cache sweep failed", e);
        }
    }

    @Override
    public void close() {
        stop();
    }
}
