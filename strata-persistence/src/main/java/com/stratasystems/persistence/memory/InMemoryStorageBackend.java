package com.stratasystems.persistence.memory;

import com.stratasystems.persistence.BackendKind;
import com.stratasystems.persistence.QueryOptions;
import com.stratasystems.persistence.RecordKeys;
import com.stratasystems.persistence.StorageBackend;
import com.stratasystems.persistence.StorageException.CorruptedRecordException;
import com.stratasystems.persistence.StoredRecord;
import com.stratasystems.persistence.codec.RecordSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Predicate;

/**
 * Process-local tier of last resort. Always available, lost on exit.
 *
 * <p>Entries are kept serialized, so callers never share mutable state with the store.
 */
public class InMemoryStorageBackend implements StorageBackend {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryStorageBackend.class);

    private final ConcurrentSkipListMap<String, byte[]> entries = new ConcurrentSkipListMap<>();

    @Override
    public BackendKind kind() {
        return BackendKind.MEMORY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public CompletableFuture<Void> open() {
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> save(String collection, String key, StoredRecord record) {
        entries.put(RecordKeys.fullKey(collection, key), RecordSerializer.toBytes(record));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Optional<StoredRecord>> load(String collection, String key) {
        String fullKey = RecordKeys.fullKey(collection, key);
        byte[] bytes = entries.get(fullKey);
        return CompletableFuture.completedFuture(bytes == null ? Optional.empty() : parse(fullKey, bytes));
    }

    @Override
    public CompletableFuture<Void> delete(String collection, String key) {
        entries.remove(RecordKeys.fullKey(collection, key));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<List<StoredRecord>> query(String collection, Predicate<StoredRecord> filter,
                                                       QueryOptions options) {
        String prefix = RecordKeys.requireCollection(collection) + RecordKeys.SEPARATOR;
        List<StoredRecord> results = new ArrayList<>();
        for (Map.Entry<String, byte[]> entry : entries.tailMap(prefix).entrySet()) {
            if (!entry.getKey().startsWith(prefix)) {
                break;
            }
            Optional<StoredRecord> record = parse(entry.getKey(), entry.getValue());
            if (record.isPresent() && filter.test(record.get())) {
                results.add(record.get());
                if (options.hasLimit() && results.size() >= options.getLimit()) {
                    break;
                }
            }
        }
        return CompletableFuture.completedFuture(results);
    }

    @Override
    public CompletableFuture<Void> clear(String collection) {
        if (collection == null) {
            entries.clear();
        } else {
            String prefix = RecordKeys.requireCollection(collection) + RecordKeys.SEPARATOR;
            entries.keySet().removeIf(k -> k.startsWith(prefix));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("available", true);
        stats.put("entries", entries.size());
        return stats;
    }

    @Override
    public void close() {
        entries.clear();
    }

    private Optional<StoredRecord> parse(String fullKey, byte[] bytes) {
        try {
            return Optional.of(RecordSerializer.fromBytes(bytes, fullKey));
        } catch (CorruptedRecordException e) {
            logger.warn("Skipping corrupted in-memory record {}", fullKey, e);
            return Optional.empty();
        }
    }
}
