package com.stratasystems.persistence.flat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stratasystems.persistence.BackendKind;
import com.stratasystems.persistence.QueryOptions;
import com.stratasystems.persistence.RecordKeys;
import com.stratasystems.persistence.StorageBackend;
import com.stratasystems.persistence.StorageException;
import com.stratasystems.persistence.StorageException.BackendUnavailableException;
import com.stratasystems.persistence.StorageException.CorruptedRecordException;
import com.stratasystems.persistence.StorageException.QuotaExceededException;
import com.stratasystems.persistence.StoredRecord;
import com.stratasystems.persistence.codec.RecordSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Flat tier over a {@link FlatFileStore}.
 *
 * <p>Raw key format: {@code <namespacePrefix><collection>:<key>}. Value format:
 * {@code {"data": <record envelope>, "timestamp": <write time millis>}}. Raw keys under
 * the namespace without a {@code ':'} after the prefix belong to other users of the store
 * (the sync queue) and are never touched by this backend.
 *
 * <p>When a write exceeds the quota the oldest share of this backend's records (by write
 * time, unreadable entries first) is evicted and the write retried once.
 */
public class FlatStorageBackend implements StorageBackend {
    private static final Logger logger = LoggerFactory.getLogger(FlatStorageBackend.class);

    private final FlatFileStore store;
    private final String namespacePrefix;
    private final double evictionFraction;
    private final Clock clock;
    private final ExecutorService ioExecutor;
    private volatile boolean closed = false;

    public FlatStorageBackend(FlatStoreConfig config) {
        this(new FlatFileStore(config), Clock.systemUTC());
    }

    public FlatStorageBackend(FlatFileStore store, Clock clock) {
        this.store = store;
        this.namespacePrefix = store.getConfig().getNamespacePrefix();
        this.evictionFraction = store.getConfig().getEvictionFraction();
        this.clock = clock;
        this.ioExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "flat-backend-io");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public BackendKind kind() {
        return BackendKind.FLAT;
    }

    @Override
    public boolean isAvailable() {
        return !closed && store.isOpen();
    }

    /**
     * @return the underlying raw store, shared with the sync queue and legacy migration
     */
    public FlatFileStore store() {
        return store;
    }

    public String namespacePrefix() {
        return namespacePrefix;
    }

    @Override
    public CompletableFuture<Void> open() {
        return submit(() -> {
            try {
                store.open();
            } catch (IOException e) {
                logger.warn("Flat store at {} could not be opened", store.getConfig().getDirectory(), e);
                throw new BackendUnavailableException(BackendKind.FLAT, "Failed to open flat store", e);
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> save(String collection, String key, StoredRecord record) {
        String rawKey = rawKey(collection, key);
        return submit(() -> {
            requireOpen();
            String wrapped = wrap(record);
            try {
                store.setItem(rawKey, wrapped);
            } catch (QuotaExceededException e) {
                int evicted = evictOldest();
                logger.warn("Flat store quota exceeded writing {}; evicted {} records and retrying", rawKey, evicted);
                store.setItem(rawKey, wrapped);
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Optional<StoredRecord>> load(String collection, String key) {
        String rawKey = rawKey(collection, key);
        return submit(() -> {
            requireOpen();
            return store.getItem(rawKey).flatMap(raw -> unwrap(rawKey, raw));
        });
    }

    @Override
    public CompletableFuture<Void> delete(String collection, String key) {
        String rawKey = rawKey(collection, key);
        return submit(() -> {
            requireOpen();
            store.removeItem(rawKey);
            return null;
        });
    }

    @Override
    public CompletableFuture<List<StoredRecord>> query(String collection, Predicate<StoredRecord> filter,
                                                       QueryOptions options) {
        String prefix = collectionPrefix(collection);
        return submit(() -> {
            requireOpen();
            List<StoredRecord> results = new ArrayList<>();
            for (String rawKey : store.keysWithPrefix(prefix)) {
                Optional<StoredRecord> record = store.getItem(rawKey).flatMap(raw -> unwrap(rawKey, raw));
                if (record.isPresent() && filter.test(record.get())) {
                    results.add(record.get());
                    if (options.hasLimit() && results.size() >= options.getLimit()) {
                        break;
                    }
                }
            }
            return results;
        });
    }

    @Override
    public CompletableFuture<Void> clear(String collection) {
        return submit(() -> {
            requireOpen();
            List<String> targets = collection == null ? recordKeys() : store.keysWithPrefix(collectionPrefix(collection));
            targets.forEach(store::removeItem);
            logger.info("Cleared {} flat records{}", targets.size(),
                collection == null ? "" : " from collection " + collection);
            return null;
        });
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("available", isAvailable());
        stats.put("directory", store.getConfig().getDirectory().toString());
        if (isAvailable()) {
            stats.put("entries", store.size());
            stats.put("usedBytes", store.usedBytes());
            stats.put("quotaBytes", store.quotaBytes());
        }
        return stats;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        ioExecutor.shutdown();
        try {
            if (!ioExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ioExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ioExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        store.close();
    }

    /**
     * Removes the oldest {@code evictionFraction} of this backend's records, at least one.
     *
     * @return number of records removed
     */
    int evictOldest() {
        List<String> keys = recordKeys();
        if (keys.isEmpty()) {
            return 0;
        }
        Map<String, Long> writeTimes = new LinkedHashMap<>();
        for (String rawKey : keys) {
            writeTimes.put(rawKey, store.getItem(rawKey).map(this::writeTimeOf).orElse(-1L));
        }
        List<String> ordered = new ArrayList<>(keys);
        ordered.sort(Comparator.comparingLong((String k) -> writeTimes.get(k)).thenComparing(k -> k));

        int toEvict = Math.max(1, (int) Math.ceil(ordered.size() * evictionFraction));
        for (int i = 0; i < toEvict; i++) {
            store.removeItem(ordered.get(i));
        }
        return toEvict;
    }

    private List<String> recordKeys() {
        List<String> result = new ArrayList<>();
        for (String rawKey : store.keysWithPrefix(namespacePrefix)) {
            if (rawKey.indexOf(RecordKeys.SEPARATOR, namespacePrefix.length()) >= 0) {
                result.add(rawKey);
            }
        }
        return result;
    }

    private long writeTimeOf(String raw) {
        try {
            JsonNode node = RecordSerializer.mapper().readTree(raw);
            JsonNode timestamp = node.get("timestamp");
            return timestamp != null && timestamp.canConvertToLong() ? timestamp.asLong() : -1L;
        } catch (JsonProcessingException e) {
            return -1L;
        }
    }

    private String wrap(StoredRecord record) {
        ObjectNode wrapper = RecordSerializer.mapper().createObjectNode();
        wrapper.set("data", RecordSerializer.toTree(record));
        wrapper.put("timestamp", clock.millis());
        try {
            return RecordSerializer.mapper().writeValueAsString(wrapper);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize record " + record.fullKey(), e);
        }
    }

    private Optional<StoredRecord> unwrap(String rawKey, String raw) {
        try {
            JsonNode data = RecordSerializer.mapper().readTree(raw).get("data");
            if (data == null || !data.isObject()) {
                throw new CorruptedRecordException("Flat entry has no data", rawKey);
            }
            return Optional.of(RecordSerializer.fromTree(data, rawKey));
        } catch (JsonProcessingException | CorruptedRecordException e) {
            logger.warn("Skipping corrupted flat record {}", rawKey, e);
            return Optional.empty();
        }
    }

    private String rawKey(String collection, String key) {
        return namespacePrefix + RecordKeys.fullKey(collection, key);
    }

    private String collectionPrefix(String collection) {
        return namespacePrefix + RecordKeys.requireCollection(collection) + RecordKeys.SEPARATOR;
    }

    private void requireOpen() {
        if (!store.isOpen()) {
            throw new BackendUnavailableException(BackendKind.FLAT, "Flat store is not open");
        }
    }

    private <T> CompletableFuture<T> submit(IoTask<T> task) {
        if (closed) {
            return CompletableFuture.failedFuture(
                new BackendUnavailableException(BackendKind.FLAT, "Backend is closed"));
        }
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            ioExecutor.execute(() -> {
                try {
                    future.complete(task.run());
                } catch (Exception e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(
                new BackendUnavailableException(BackendKind.FLAT, "Backend is shutting down", e));
        }
        return future;
    }

    @FunctionalInterface
    private interface IoTask<T> {
        T run() throws Exception;
    }
}
