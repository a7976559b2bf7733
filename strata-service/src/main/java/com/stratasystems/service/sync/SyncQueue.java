package com.stratasystems.service.sync;

import com.stratasystems.persistence.StorageException;
import com.stratasystems.persistence.StoredRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Durable FIFO of writes that no backend accepted, replayed later by {@link #drain}.
 *
 * <p>Item life cycle: pending, then one attempt per drain pass. A successful attempt removes
 * the item; a failed one leaves it pending until it reaches its attempt limit, at which
 * point it is dropped and reported in the {@link DrainResult}.
 *
 * <p>The queue holds at most one item per (collection, key): enqueueing replaces older items
 * for the key, and {@link #supersede} drops them once a newer write reached a backend.
 *
 * <p>Only one drain runs at a time. Items enqueued while a pass is running wait for the
 * next pass; items superseded while it runs are skipped.
 */
public class SyncQueue {
    private static final Logger logger = LoggerFactory.getLogger(SyncQueue.class);

    private final SyncQueueStore store;
    private final int maxAttempts;
    private final Clock clock;
    private final Map<String, SyncQueueItem> items = new LinkedHashMap<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    public SyncQueue(SyncQueueStore store, int maxAttempts, Clock clock) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("Max attempts must be positive");
        }
        this.store = store;
        this.maxAttempts = maxAttempts;
        this.clock = clock;
    }

    /**
     * Replaces the in-memory queue with the persisted one.
     *
     * @return the number of items restored
     */
    public int restore() {
        List<SyncQueueItem> persisted = store.load();
        synchronized (items) {
            items.clear();
            persisted.forEach(item -> items.put(item.getId(), item));
        }
        if (!persisted.isEmpty()) {
            logger.info("Sync queue restored with {} items", persisted.size());
        }
        return persisted.size();
    }

    /**
     * Queues a save and persists the queue.
     *
     * @throws StorageException if the queue could not be persisted; the item stays queued in memory
     */
    public SyncQueueItem enqueueSave(String collection, String key, StoredRecord record) {
        return enqueue(SyncOperation.SAVE, collection, key, record);
    }

    /**
     * Queues a delete and persists the queue.
     *
     * @throws StorageException if the queue could not be persisted; the item stays queued in memory
     */
    public SyncQueueItem enqueueDelete(String collection, String key) {
        return enqueue(SyncOperation.DELETE, collection, key, null);
    }

    private SyncQueueItem enqueue(SyncOperation operation, String collection, String key, StoredRecord record) {
        SyncQueueItem item = new SyncQueueItem(UUID.randomUUID().toString(), operation, collection, key,
            record, clock.millis(), 0, maxAttempts);
        int replaced;
        synchronized (items) {
            replaced = removeFor(collection, key);
            items.put(item.getId(), item);
        }
        logger.debug("Queued {} {}:{} for sync, replacing {} older items", operation, collection, key, replaced);
        persist();
        return item;
    }

    /**
     * Drops every pending item for (collection, key). Called once a newer write or delete of
     * that key has been applied directly, so a later drain cannot replay an older value over it.
     *
     * @return the number of items dropped
     */
    public int supersede(String collection, String key) {
        int removed;
        synchronized (items) {
            removed = removeFor(collection, key);
        }
        if (removed > 0) {
            logger.debug("Dropped {} queued items for {}:{} superseded by a direct write", removed, collection, key);
            persistQuietly();
        }
        return removed;
    }

    private int removeFor(String collection, String key) {
        int removed = 0;
        for (Iterator<SyncQueueItem> it = items.values().iterator(); it.hasNext(); ) {
            SyncQueueItem pending = it.next();
            if (pending.getCollection().equals(collection) && pending.getKey().equals(key)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Replays a snapshot of the queue in insertion order.
     *
     * @param executor replays one item, resolving the target backend per item
     * @param online whether the service is online; offline passes are skipped
     * @return the pass outcome, {@link DrainResult#isSkipped() skipped} if no pass ran
     */
    public CompletableFuture<DrainResult> drain(SyncItemExecutor executor, boolean online) {
        if (!online) {
            logger.debug("Offline, skipping sync queue drain");
            return CompletableFuture.completedFuture(DrainResult.skipped(size()));
        }
        if (!draining.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(DrainResult.skipped(size()));
        }
        List<SyncQueueItem> snapshot = items();
        if (snapshot.isEmpty()) {
            draining.set(false);
            return CompletableFuture.completedFuture(new DrainResult(0, List.of(), 0, false));
        }
        logger.info("Draining sync queue: {} items", snapshot.size());

        List<String> processed = Collections.synchronizedList(new ArrayList<>());
        List<SyncQueueItem> dropped = Collections.synchronizedList(new ArrayList<>());
        CompletableFuture<Void> pass = CompletableFuture.completedFuture(null);
        for (SyncQueueItem item : snapshot) {
            pass = pass.thenCompose(v -> attempt(item, executor, processed, dropped));
        }
        return pass.handle((v, error) -> {
            try {
                if (error != null) {
                    logger.error("Sync queue drain aborted", error);
                }
                synchronized (items) {
                    processed.forEach(items::remove);
                    dropped.forEach(item -> items.remove(item.getId()));
                }
                persistQuietly();
                DrainResult result = new DrainResult(processed.size(), dropped, size(), false);
                logger.info("Sync queue processed: {}", result);
                return result;
            } finally {
                draining.set(false);
            }
        });
    }

    private CompletableFuture<Void> attempt(SyncQueueItem item, SyncItemExecutor executor,
                                            List<String> processed, List<SyncQueueItem> dropped) {
        SyncQueueItem attempted = item.withAttempt();
        synchronized (items) {
            if (items.replace(attempted.getId(), attempted) == null) {
                logger.debug("Skipping {}, superseded since the pass started", item);
                return CompletableFuture.completedFuture(null);
            }
        }
        CompletableFuture<Void> result;
        try {
            result = executor.execute(attempted);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.handle((v, error) -> {
            if (error == null) {
                processed.add(attempted.getId());
                logger.debug("Synced {}", attempted);
            } else if (attempted.isExhausted()) {
                dropped.add(attempted);
                logger.error("Dropping {} after {} attempts", attempted, attempted.getAttempts(), error);
            } else {
                logger.warn("Sync attempt failed for {}: {}", attempted, error.getMessage());
            }
            return null;
        });
    }

    /**
     * Writes the current queue to its store.
     *
     * @throws StorageException if the store rejects the write
     */
    public void persist() {
        store.save(items());
    }

    private void persistQuietly() {
        try {
            persist();
        } catch (StorageException e) {
            logger.warn("Failed to persist sync queue", e);
        }
    }

    /**
     * Drops every pending item and persists the empty queue.
     */
    public void clear() {
        synchronized (items) {
            items.clear();
        }
        persistQuietly();
    }

    /**
     * @return a snapshot of the pending items in insertion order
     */
    public List<SyncQueueItem> items() {
        synchronized (items) {
            return new ArrayList<>(items.values());
        }
    }

    public int size() {
        synchronized (items) {
            return items.size();
        }
    }

    public boolean isDraining() {
        return draining.get();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
