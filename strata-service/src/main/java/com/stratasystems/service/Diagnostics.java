package com.stratasystems.service;

import com.stratasystems.service.sync.SyncQueueItem;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Debug snapshot: service stats, per-backend state, a sample of cache keys and the pending
 * queue.
 */
public final class Diagnostics {

    static final int CACHE_KEY_SAMPLE = 10;

    private final PersistenceStats service;
    private final Map<String, BackendState> backends;
    private final int cacheSize;
    private final List<String> cacheKeys;
    private final List<QueuedOperation> syncQueue;

    Diagnostics(PersistenceStats service, Map<String, BackendState> backends, int cacheSize,
                List<String> cacheKeys, List<SyncQueueItem> queue) {
        this.service = service;
        this.backends = Collections.unmodifiableMap(new LinkedHashMap<>(backends));
        this.cacheSize = cacheSize;
        this.cacheKeys = cacheKeys.stream().limit(CACHE_KEY_SAMPLE).collect(Collectors.toUnmodifiableList());
        this.syncQueue = queue.stream().map(QueuedOperation::new).collect(Collectors.toUnmodifiableList());
    }

    public PersistenceStats getService() { return service; }
    public Map<String, BackendState> getBackends() { return backends; }
    public int getCacheSize() { return cacheSize; }

    /**
     * @return at most the first ten cache keys in sorted order
     */
    public List<String> getCacheKeys() { return cacheKeys; }

    public List<QueuedOperation> getSyncQueue() { return syncQueue; }

    public static final class BackendState {
        private final boolean available;
        private final Map<String, Object> stats;

        BackendState(boolean available, Map<String, Object> stats) {
            this.available = available;
            this.stats = stats;
        }

        public boolean isAvailable() { return available; }
        public Map<String, Object> getStats() { return stats; }
    }

    public static final class QueuedOperation {
        private final String operation;
        private final String collection;
        private final String key;
        private final int attempts;

        QueuedOperation(SyncQueueItem item) {
            this.operation = item.getOperation().name().toLowerCase();
            this.collection = item.getCollection();
            this.key = item.getKey();
            this.attempts = item.getAttempts();
        }

        public String getOperation() { return operation; }
        public String getCollection() { return collection; }
        public String getKey() { return key; }
        public int getAttempts() { return attempts; }
    }
}
