package com.stratasystems.persistence;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Uniform contract for one physical storage tier.
 *
 * <p>All data operations are asynchronous and report failure by completing the returned
 * future exceptionally, normally with a {@link StorageException}. A write either stores
 * the whole record or nothing. Implementations own their connection or handle state;
 * the orchestrator owns the ordering between backends.
 */
public interface StorageBackend extends AutoCloseable {

    /**
     * @return the tier this backend implements
     */
    BackendKind kind();

    /**
     * @return the name used in logs and events
     */
    default String name() {
        return kind().id();
    }

    /**
     * @return fallback priority, lower is preferred
     */
    default int priority() {
        return kind().priority();
    }

    default BackendCapabilities capabilities() {
        return BackendCapabilities.ALL;
    }

    /**
     * Cheap capability probe: a live handle exists and the last known state is healthy.
     * Never throws and never performs I/O.
     *
     * @return true if operations are expected to succeed
     */
    boolean isAvailable();

    /**
     * Acquires the backend's handle (connects, opens the environment, creates directories).
     * A failed open leaves the backend unavailable.
     *
     * @return a future completing once the backend is ready
     */
    CompletableFuture<Void> open();

    /**
     * Idempotent upsert keyed by (collection, key).
     */
    CompletableFuture<Void> save(String collection, String key, StoredRecord record);

    /**
     * Loads a record. An empty result means "not found", which is not an error; a
     * record that cannot be parsed is also reported as not found.
     */
    CompletableFuture<Optional<StoredRecord>> load(String collection, String key);

    /**
     * Deletes a record. Deleting an absent key succeeds.
     */
    CompletableFuture<Void> delete(String collection, String key);

    /**
     * Returns the records of a collection accepted by {@code filter}, in key order,
     * truncated to {@code options.getLimit()} when a limit is set.
     */
    CompletableFuture<List<StoredRecord>> query(String collection, Predicate<StoredRecord> filter,
                                                QueryOptions options);

    /**
     * Drops one collection, or everything this backend holds when {@code collection} is null.
     */
    CompletableFuture<Void> clear(String collection);

    /**
     * @return backend specific statistics for diagnostics
     */
    default Map<String, Object> describe() {
        return Map.of("available", isAvailable());
    }

    /**
     * Releases the handle. Safe to call more than once.
     */
    @Override
    void close();
}
