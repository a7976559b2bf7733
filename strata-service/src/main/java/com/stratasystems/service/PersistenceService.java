package com.stratasystems.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stratasystems.persistence.BackendKind;
import com.stratasystems.persistence.QueryFilter;
import com.stratasystems.persistence.QueryOptions;
import com.stratasystems.persistence.RecordKeys;
import com.stratasystems.persistence.RecordMetadata;
import com.stratasystems.persistence.StorageBackend;
import com.stratasystems.persistence.StorageException;
import com.stratasystems.persistence.StorageException.BackendUnavailableException;
import com.stratasystems.persistence.StorageException.CorruptedRecordException;
import com.stratasystems.persistence.StoredRecord;
import com.stratasystems.persistence.codec.CompressedValue;
import com.stratasystems.persistence.codec.CompressionCodec;
import com.stratasystems.persistence.codec.GzipCompressionCodec;
import com.stratasystems.persistence.codec.RecordSerializer;
import com.stratasystems.persistence.etcd.EtcdBackendConfig;
import com.stratasystems.persistence.etcd.EtcdStorageBackend;
import com.stratasystems.persistence.event.PersistenceEventBus;
import com.stratasystems.persistence.event.PersistenceEventType;
import com.stratasystems.persistence.flat.FlatStorageBackend;
import com.stratasystems.persistence.flat.FlatStoreConfig;
import com.stratasystems.persistence.lmdb.LmdbConfig;
import com.stratasystems.persistence.lmdb.LmdbStorageBackend;
import com.stratasystems.persistence.memory.InMemoryStorageBackend;
import com.stratasystems.service.cache.CacheEntry;
import com.stratasystems.service.cache.CacheSweeper;
import com.stratasystems.service.cache.QueryCacheKeys;
import com.stratasystems.service.cache.RecordCache;
import com.stratasystems.service.connectivity.ConnectivityMonitor;
import com.stratasystems.service.connectivity.ManualConnectivityMonitor;
import com.stratasystems.service.connectivity.ProbingConnectivityMonitor;
import com.stratasystems.service.migration.LegacyMigrationImporter;
import com.stratasystems.service.migration.MigrationReport;
import com.stratasystems.service.sync.DrainResult;
import com.stratasystems.service.sync.FlatSyncQueueStore;
import com.stratasystems.service.sync.SyncQueue;
import com.stratasystems.service.sync.SyncQueueItem;
import com.stratasystems.service.sync.SyncQueueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Single entry point for durable key/value storage across the configured tiers.
 *
 * <p>Writes go to the active backend (the highest-priority available one) and fall back
 * down the chain on failure. A write that no tier accepts, or any write made while
 * offline, is queued and replayed once connectivity returns. A save is reported
 * successful as soon as one tier or the sync queue holds it; replication to the
 * preferred tier is eventual.
 *
 * <p>Reads are served from the cache when fresh, otherwise from the active backend and then
 * the rest of the chain. Missing values and read errors yield the caller's default.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * PersistenceService service = PersistenceService.builder()
 *     .config(PersistenceConfig.defaults())
 *     .defaultBackends(dataDir, EtcdBackendConfig.fromEnvironment())
 *     .build();
 *
 * service.initialize().join();
 * service.save("settings", "theme", Map.of("mode", "dark")).join();
 * Settings s = service.load("settings", "theme", Settings.class, Settings.DEFAULT).join();
 * service.close();
 * }</pre>
 */
public class PersistenceService implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PersistenceService.class);

    public static final String SYSTEM_COLLECTION = "system";
    public static final String PERSISTENT_CACHE_KEY = "persistent_cache";

    static final Duration DEFAULT_PROBE_INTERVAL = Duration.ofSeconds(15);

    private static final String QUERY_COLLECTION = "query";
    private static final String PERSISTENT_CACHE_FULL_KEY = RecordKeys.fullKey(SYSTEM_COLLECTION, PERSISTENT_CACHE_KEY);
    private static final List<String> PERSISTENT_CACHE_PREFIXES = List.of("system:", "config:");
    private static final Set<String> INTERNAL_COLLECTIONS = Set.of(QUERY_COLLECTION, SYSTEM_COLLECTION);

    private final PersistenceConfig config;
    private final FallbackChain chain;
    private final RecordCache cache;
    private final CacheSweeper sweeper;
    private final SyncQueue syncQueue;
    private final LegacyMigrationImporter migrationImporter;
    private final ConnectivityMonitor connectivity;
    private final CompressionCodec codec;
    private final PersistenceEventBus eventBus;
    private final boolean ownsEventBus;
    private final Clock clock;
    private final ScheduledExecutorService timers;
    private final Set<String> knownCollections = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile StorageBackend active;
    private volatile boolean initialized = false;
    private CompletableFuture<Boolean> initialization;
    private Runnable connectivitySubscription;

    private PersistenceService(Builder builder) {
        this.config = builder.config;
        this.chain = new FallbackChain(builder.backends);
        this.clock = builder.clock;
        this.codec = builder.codec != null ? builder.codec : new GzipCompressionCodec();
        this.ownsEventBus = builder.eventBus == null;
        this.eventBus = ownsEventBus ? new PersistenceEventBus() : builder.eventBus;
        this.connectivity = builder.connectivity != null ? builder.connectivity : new ManualConnectivityMonitor(true);
        this.cache = new RecordCache(config.getCacheTtl(), config.isCacheEnabled(), config.getCacheMaxEntries(), clock);
        this.sweeper = new CacheSweeper(cache, config.getCacheSweepInterval());

        FlatStorageBackend flat = chain.get(BackendKind.FLAT)
            .filter(FlatStorageBackend.class::isInstance)
            .map(FlatStorageBackend.class::cast)
            .orElse(null);
        SyncQueueStore queueStore = builder.syncQueueStore;
        if (queueStore == null) {
            queueStore = flat != null
                ? new FlatSyncQueueStore(flat.store(), flat.namespacePrefix())
                : SyncQueueStore.NONE;
        }
        this.syncQueue = new SyncQueue(queueStore, config.getSyncMaxAttempts(), clock);
        this.migrationImporter = flat == null ? null : new LegacyMigrationImporter(flat.store(),
            config.getLegacyPrefixes(), flat.namespacePrefix(), config.getMigrationCollection());

        this.timers = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "persistence-service-timers");
            t.setDaemon(true);
            return t;
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------- lifecycle

    /**
     * Opens every backend, selects the active one, restores the sync queue and persistent
     * cache, imports legacy data if enabled, starts background tasks and drains the queue.
     * Calling it again returns the first call's future.
     *
     * @return a future completing with true once the service is ready, or exceptionally with
     *         {@link PersistenceInitializationException} if no backend could be opened
     */
    public synchronized CompletableFuture<Boolean> initialize() {
        if (closed.get()) {
            return CompletableFuture.failedFuture(
                new PersistenceInitializationException("Persistence service is closed"));
        }
        if (initialization != null) {
            return initialization;
        }
        logger.info("Initializing persistence service: {}, {}", chain, config);
        initialization = openBackends()
            .thenCompose(v -> {
                determineActiveBackend();
                restoreSyncQueue();
                return restorePersistentCache();
            })
            .thenCompose(v -> config.isMigrationEnabled()
                ? migrateOldData().thenApply(report -> (Void) null)
                : CompletableFuture.<Void>completedFuture(null))
            .thenCompose(v -> {
                startBackgroundTasks();
                initialized = true;
                return drainSyncQueue();
            })
            .thenApply(drained -> {
                List<String> available = availableBackendNames();
                logger.info("Persistence service ready. Active backend: {}, available: {}", activeName(), available);
                publish(PersistenceEventType.READY, attributes(
                    "activeBackend", activeName(),
                    "availableBackends", available));
                return true;
            });
        return initialization;
    }

    private CompletableFuture<Void> openBackends() {
        List<CompletableFuture<Void>> opening = new ArrayList<>();
        for (StorageBackend backend : chain.all()) {
            opening.add(safely(backend::open).handle((v, error) -> {
                if (error != null) {
                    logger.warn("Backend {} failed to open: {}", backend.name(), unwrap(error).getMessage());
                } else {
                    logger.info("Backend {} opened", backend.name());
                }
                return null;
            }));
        }
        return CompletableFuture.allOf(opening.toArray(new CompletableFuture[0]));
    }

    private void restoreSyncQueue() {
        try {
            syncQueue.restore();
        } catch (StorageException e) {
            logger.warn("Failed to restore sync queue, starting empty", e);
        }
    }

    private void startBackgroundTasks() {
        sweeper.start();
        long syncMs = config.getSyncInterval().toMillis();
        timers.scheduleAtFixedRate(this::syncTick, syncMs, syncMs, TimeUnit.MILLISECONDS);
        if (config.isPersistentCacheEnabled() && cache.isEnabled()) {
            long flushMs = config.getPersistentCacheInterval().toMillis();
            timers.scheduleAtFixedRate(this::persistentCacheTick, flushMs, flushMs, TimeUnit.MILLISECONDS);
        }
        connectivitySubscription = connectivity.addListener(this::onConnectivityChanged);
        connectivity.start();
        logger.info("Auto-sync every {}, cache sweep every {}", config.getSyncInterval(), config.getCacheSweepInterval());
    }

    /**
     * Stops background work, flushes the persistent cache and the sync queue, then closes
     * every backend.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Closing persistence service");
        if (connectivitySubscription != null) {
            connectivitySubscription.run();
        }
        connectivity.close();
        sweeper.stop();
        timers.shutdownNow();

        if (initialized) {
            try {
                flushPersistentCache().get(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException | TimeoutException e) {
                logger.warn("Failed to flush persistent cache on close", e);
            }
            try {
                syncQueue.persist();
            } catch (StorageException e) {
                logger.warn("Failed to persist sync queue on close", e);
            }
        }
        initialized = false;

        for (StorageBackend backend : chain.all()) {
            try {
                backend.close();
            } catch (RuntimeException e) {
                logger.warn("Error closing backend {}", backend.name(), e);
            }
        }
        if (ownsEventBus) {
            eventBus.close();
        }
        logger.info("Persistence service closed");
    }

    // ---------------------------------------------------------------- backend selection

    /**
     * Makes the highest-priority available backend the active one.
     *
     * @return the active backend
     * @throws PersistenceInitializationException if no backend is available
     */
    public synchronized StorageBackend determineActiveBackend() {
        StorageBackend resolved = chain.firstAvailable().orElseThrow(() ->
            new PersistenceInitializationException("No storage backend available in " + chain));
        StorageBackend previous = active;
        active = resolved;
        if (previous == null) {
            logger.info("Active backend: {}", resolved.name());
        } else if (previous != resolved) {
            logger.info("Active backend changed from {} to {}", previous.name(), resolved.name());
            publish(PersistenceEventType.BACKEND_CHANGED, attributes(
                "from", previous.name(), "to", resolved.name(), "reason", "resolved"));
        }
        return resolved;
    }

    /**
     * Moves the active pointer past a failed backend to the next available one below it.
     * Does nothing if the active backend is already a different one.
     *
     * @return the backend that is active afterwards, empty if none is left
     */
    public synchronized Optional<StorageBackend> handleBackendFailure(BackendKind failed) {
        StorageBackend current = active;
        if (current != null && current.kind() != failed) {
            return Optional.of(current);
        }
        Optional<StorageBackend> next = chain.nextAvailableAfter(failed);
        if (next.isEmpty()) {
            logger.error("Backend {} failed and no fallback backend is available", failed.id());
            return Optional.empty();
        }
        active = next.get();
        logger.warn("Backend {} failed, switched to {}", failed.id(), next.get().name());
        publish(PersistenceEventType.BACKEND_CHANGED, attributes(
            "from", failed.id(), "to", next.get().name(), "reason", "failure"));
        return next;
    }

    // ---------------------------------------------------------------- save

    public CompletableFuture<Boolean> save(String collection, String key, Object value) {
        return save(collection, key, value, SaveOptions.DEFAULT);
    }

    /**
     * Stores a value under (collection, key).
     *
     * @return a future completing with true once some tier or the sync queue holds the
     *         value, or exceptionally with {@link PersistenceException} if even the direct
     *         flat-tier write failed
     * @throws IllegalArgumentException if the collection or key is invalid, or the collection
     *         is reserved for the service
     */
    public CompletableFuture<Boolean> save(String collection, String key, Object value, SaveOptions options) {
        return store(requireUserCollection(collection), key, value, options);
    }

    private CompletableFuture<Boolean> store(String collection, String key, Object value, SaveOptions options) {
        String fullKey = RecordKeys.fullKey(collection, key);
        Objects.requireNonNull(options, "options");
        StorageBackend primary = active;
        if (primary == null) {
            return CompletableFuture.failedFuture(notInitialized());
        }
        JsonNode node = toNode(value);
        StoredRecord record;
        try {
            record = buildRecord(collection, key, node, options);
        } catch (RuntimeException e) {
            logger.error("Failed to encode {}, writing it directly to the flat tier", fullKey, e);
            return directFlatWrite(collection, key, plainRecord(collection, key, node, options), e, false);
        }

        knownCollections.add(collection);
        cache.put(fullKey, record, primary.kind());
        cache.invalidateQueries(collection);

        AtomicBoolean queued = new AtomicBoolean(false);
        return firstAccepting(candidates(primary), "save " + fullKey,
                backend -> backend.save(collection, key, record).thenApply(v -> Boolean.TRUE),
                accepted -> true)
            .thenApply(served -> {
                boolean online = isOnline();
                if (served.isPresent() && online) {
                    syncQueue.supersede(collection, key);
                } else {
                    // set first: enqueue keeps the item in memory even when persisting the queue fails
                    queued.set(true);
                    syncQueue.enqueueSave(collection, key, record);
                    logger.info("Queued save of {} for sync ({})", fullKey, online ? "no backend accepted it" : "offline");
                }
                publishSaved(collection, key, record, served.map(s -> s.backend).orElse(null), queued.get());
                return Boolean.TRUE;
            })
            .handle((ok, error) -> error == null
                ? CompletableFuture.completedFuture(ok)
                : directFlatWrite(collection, key, record, unwrap(error), queued.get()))
            .thenCompose(Function.identity());
    }

    private void publishSaved(String collection, String key, StoredRecord record, BackendKind backend,
                              boolean queued) {
        publish(PersistenceEventType.SAVED, attributes(
            "collection", collection,
            "key", key,
            "backend", backend == null ? null : backend.id(),
            "queued", queued,
            "compressed", record.isCompressed()));
    }

    private StoredRecord buildRecord(String collection, String key, JsonNode value, SaveOptions options) {
        if (!shouldCompress(value, options.getCompression())) {
            return plainRecord(collection, key, value, options);
        }
        long size = RecordSerializer.sizeOf(value);
        CompressedValue compressed = codec.compress(value);
        RecordMetadata metadata = RecordMetadata.compressed(collection, key, clock.millis(), ttlOf(options),
            size, compressed.getAlgorithm(), compressed.getCompressedSize());
        logger.debug("Compressed {}:{} from {} to {} bytes", collection, key, size, compressed.getCompressedSize());
        return new StoredRecord(metadata, compressed.asNode());
    }

    private StoredRecord plainRecord(String collection, String key, JsonNode value, SaveOptions options) {
        return new StoredRecord(
            RecordMetadata.plain(collection, key, clock.millis(), ttlOf(options), RecordSerializer.sizeOf(value)),
            value);
    }

    private boolean shouldCompress(JsonNode value, CompressionMode mode) {
        switch (mode) {
            case ALWAYS:
                return true;
            case NEVER:
                return false;
            default:
                return config.isCompressionEnabled() && codec.shouldCompress(value, config.getCompressionThreshold());
        }
    }

    private long ttlOf(SaveOptions options) {
        return options.getTtlMillis() != null ? options.getTtlMillis() : config.getDefaultTtl().toMillis();
    }

    /**
     * Last resort when the normal save path broke: one write straight to the flat tier.
     *
     * @param queued whether the sync queue holds the record in memory
     */
    private CompletableFuture<Boolean> directFlatWrite(String collection, String key, StoredRecord record,
                                                       Throwable cause, boolean queued) {
        String fullKey = record.fullKey();
        Optional<StorageBackend> flat = chain.get(BackendKind.FLAT).filter(StorageBackend::isAvailable);
        if (flat.isEmpty()) {
            return CompletableFuture.failedFuture(new PersistenceException("Failed to save " + fullKey, cause));
        }
        return safely(() -> flat.get().save(collection, key, record)).handle((v, error) -> {
            if (error != null) {
                PersistenceException failure = new PersistenceException("Failed to save " + fullKey, cause);
                failure.addSuppressed(unwrap(error));
                throw new CompletionException(failure);
            }
            logger.warn("Saved {} directly to the flat tier after: {}", fullKey, cause.getMessage());
            if (!queued) {
                syncQueue.supersede(collection, key);
            }
            publishSaved(collection, key, record, BackendKind.FLAT, queued);
            return Boolean.TRUE;
        });
    }

    // ---------------------------------------------------------------- load

    public <T> CompletableFuture<T> load(String collection, String key, Class<T> type, T defaultValue) {
        return load(collection, key, type, defaultValue, LoadOptions.DEFAULT);
    }

    /**
     * Reads and decodes a value, converting it to {@code type}.
     *
     * @return the value, or {@code defaultValue} if it is missing, unreadable or not
     *         convertible; never completes exceptionally
     */
    public <T> CompletableFuture<T> load(String collection, String key, Class<T> type, T defaultValue,
                                         LoadOptions options) {
        Objects.requireNonNull(type, "type");
        return loadNode(collection, key, options)
            .thenApply(node -> node.map(n -> RecordSerializer.mapper().convertValue(n, type)).orElse(defaultValue))
            .exceptionally(error -> {
                logger.warn("Failed to load {}:{}, returning default: {}", collection, key, unwrap(error).getMessage());
                return defaultValue;
            });
    }

    public CompletableFuture<Optional<JsonNode>> loadNode(String collection, String key) {
        return loadNode(collection, key, LoadOptions.DEFAULT);
    }

    /**
     * Reads and decodes a value as a JSON tree.
     *
     * @return the decoded value, empty if no tier holds it
     * @throws IllegalArgumentException if the collection or key is invalid, or the collection
     *         is reserved for the service
     */
    public CompletableFuture<Optional<JsonNode>> loadNode(String collection, String key, LoadOptions options) {
        return fetch(requireUserCollection(collection), key, options);
    }

    private CompletableFuture<Optional<JsonNode>> fetch(String collection, String key, LoadOptions options) {
        String fullKey = RecordKeys.fullKey(collection, key);
        StorageBackend primary = active;
        if (primary == null) {
            return CompletableFuture.failedFuture(notInitialized());
        }
        knownCollections.add(collection);

        if (!options.isForceRefresh()) {
            Optional<CacheEntry> cached = cache.get(fullKey);
            if (cached.isPresent()) {
                try {
                    JsonNode value = decode(cached.get().getData());
                    logger.debug("Cache hit: {}", fullKey);
                    publish(PersistenceEventType.LOADED, attributes(
                        "collection", collection, "key", key, "found", true, "source", "cache"));
                    return CompletableFuture.completedFuture(Optional.of(value));
                } catch (CorruptedRecordException e) {
                    logger.warn("Dropping undecodable cache entry {}", fullKey, e);
                    cache.invalidate(fullKey);
                }
            }
        }

        return firstAccepting(candidates(primary), "load " + fullKey,
                backend -> backend.load(collection, key),
                Optional::isPresent)
            .thenApply(served -> {
                Optional<JsonNode> value = Optional.empty();
                if (served.isPresent()) {
                    StoredRecord record = served.get().value.get();
                    try {
                        value = Optional.of(decode(record));
                        cache.put(fullKey, record, served.get().backend);
                    } catch (CorruptedRecordException e) {
                        logger.warn("Treating undecodable record {} as missing", fullKey, e);
                    }
                }
                publish(PersistenceEventType.LOADED, attributes(
                    "collection", collection,
                    "key", key,
                    "found", value.isPresent(),
                    "source", served.map(s -> s.backend.id()).orElse(null)));
                return value;
            });
    }

    /**
     * @return true if a fresh cache entry exists for the record
     */
    public boolean isCached(String collection, String key) {
        return cache.get(RecordKeys.fullKey(collection, key)).isPresent();
    }

    // ---------------------------------------------------------------- delete

    /**
     * Removes a record from the cache, the active backend and every other available one.
     * If the active backend could not delete it, or the service is offline, the delete is
     * also queued for replay; otherwise any write still queued for the key is dropped.
     *
     * @throws IllegalArgumentException if the collection or key is invalid, or the collection
     *         is reserved for the service
     */
    public CompletableFuture<Boolean> delete(String collection, String key) {
        String fullKey = RecordKeys.fullKey(requireUserCollection(collection), key);
        StorageBackend primary = active;
        if (primary == null) {
            return CompletableFuture.failedFuture(notInitialized());
        }
        cache.invalidate(fullKey);
        cache.invalidateQueries(collection);

        return deleteOn(primary, collection, key)
            .thenCompose(activeOk -> {
                if (!activeOk) {
                    handleBackendFailure(primary.kind());
                }
                List<CompletableFuture<Boolean>> others = chain.others(primary).stream()
                    .filter(StorageBackend::isAvailable)
                    .map(backend -> deleteOn(backend, collection, key))
                    .collect(Collectors.toList());
                return CompletableFuture.allOf(others.toArray(new CompletableFuture[0]))
                    .thenApply(v -> {
                        boolean online = isOnline();
                        boolean queued = false;
                        if (!activeOk || !online) {
                            syncQueue.enqueueDelete(collection, key);
                            queued = true;
                        } else {
                            syncQueue.supersede(collection, key);
                        }
                        publish(PersistenceEventType.DELETED, attributes(
                            "collection", collection, "key", key, "queued", queued));
                        return Boolean.TRUE;
                    });
            })
            .handle((ok, error) -> {
                if (error != null) {
                    throw new CompletionException(new PersistenceException("Failed to delete " + fullKey, unwrap(error)));
                }
                return ok;
            });
    }

    private CompletableFuture<Boolean> deleteOn(StorageBackend backend, String collection, String key) {
        if (!backend.isAvailable()) {
            return CompletableFuture.completedFuture(false);
        }
        return safely(() -> backend.delete(collection, key)).handle((v, error) -> {
            if (error != null) {
                logger.warn("Delete of {}:{} failed on {}: {}", collection, key, backend.name(), unwrap(error).getMessage());
                return false;
            }
            return true;
        });
    }

    // ---------------------------------------------------------------- query

    public CompletableFuture<List<JsonNode>> query(String collection) {
        return query(collection, QueryFilter.ALL, QueryOptions.DEFAULT);
    }

    /**
     * Returns the decoded values of a collection that match {@code filter}.
     *
     * <p>Result sets are cached per (collection, filter, limit) and invalidated by any write
     * to the collection. The first tier returning a non-empty result wins.
     *
     * @return the matching values in key order; empty if nothing matched or every tier failed
     */
    public CompletableFuture<List<JsonNode>> query(String collection, QueryFilter filter, QueryOptions options) {
        requireUserCollection(collection);
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(options, "options");
        StorageBackend primary = active;
        if (primary == null) {
            return CompletableFuture.failedFuture(notInitialized());
        }
        knownCollections.add(collection);
        String cacheKey = QueryCacheKeys.of(collection, filter, options);

        if (!options.isForceRefresh()) {
            Optional<CacheEntry> cached = cache.get(cacheKey);
            if (cached.isPresent()) {
                List<JsonNode> results = new ArrayList<>();
                cached.get().getData().getValue().forEach(results::add);
                logger.debug("Query cache hit: {}", cacheKey);
                publish(PersistenceEventType.QUERIED, attributes(
                    "collection", collection, "count", results.size(), "source", "cache"));
                return CompletableFuture.completedFuture(results);
            }
        }

        Predicate<StoredRecord> matcher = record -> {
            Optional<JsonNode> decoded = decodeQuietly(record);
            return decoded.isPresent() && filter.matches(decoded.get());
        };
        return firstAccepting(candidates(primary), "query " + collection,
                backend -> backend.capabilities().supportsQuery()
                    ? backend.query(collection, matcher, options)
                    : CompletableFuture.completedFuture(List.<StoredRecord>of()),
                results -> !results.isEmpty())
            .thenApply(served -> {
                List<JsonNode> values = new ArrayList<>();
                served.ifPresent(s -> s.value.forEach(record -> decodeQuietly(record).ifPresent(values::add)));
                cacheQueryResult(cacheKey, values, served.map(s -> s.backend).orElse(primary.kind()));
                publish(PersistenceEventType.QUERIED, attributes(
                    "collection", collection,
                    "count", values.size(),
                    "source", served.map(s -> s.backend.id()).orElse(null)));
                return values;
            })
            .exceptionally(error -> {
                logger.warn("Query on {} failed: {}", collection, unwrap(error).getMessage());
                return List.of();
            });
    }

    private void cacheQueryResult(String cacheKey, List<JsonNode> values, BackendKind source) {
        ArrayNode array = RecordSerializer.mapper().createArrayNode();
        values.forEach(array::add);
        String key = cacheKey.substring(RecordCache.QUERY_PREFIX.length());
        RecordMetadata metadata = RecordMetadata.plain(QUERY_COLLECTION, key, clock.millis(),
            RecordMetadata.INFINITE_TTL, 0);
        cache.put(cacheKey, new StoredRecord(metadata, array), source);
    }

    // ---------------------------------------------------------------- clear / export

    /**
     * Clears one collection, or everything when {@code collection} is null, from the cache
     * and every available backend. Clearing everything also empties the sync queue.
     */
    public CompletableFuture<Void> clear(String collection) {
        if (collection != null) {
            requireUserCollection(collection);
            cache.invalidateCollection(collection);
            knownCollections.remove(collection);
        } else {
            cache.clear();
            knownCollections.clear();
        }
        logger.info("Clearing {}", collection == null ? "all data" : "collection " + collection);

        List<CompletableFuture<Void>> clearing = new ArrayList<>();
        for (StorageBackend backend : chain.available()) {
            if (!backend.capabilities().supportsClear()) {
                continue;
            }
            clearing.add(safely(() -> backend.clear(collection)).handle((v, error) -> {
                if (error != null) {
                    logger.warn("Failed to clear {}: {}", backend.name(), unwrap(error).getMessage());
                }
                return null;
            }));
        }
        return CompletableFuture.allOf(clearing.toArray(new CompletableFuture[0])).thenRun(() -> {
            if (collection == null) {
                syncQueue.clear();
            }
            publish(PersistenceEventType.CLEARED, attributes("collection", collection));
        });
    }

    /**
     * Exports decoded contents of one collection, or of every known user collection when
     * {@code collection} is null.
     */
    public CompletableFuture<ExportSnapshot> export(String collection) {
        List<String> targets = collection != null
            ? List.of(requireUserCollection(collection))
            : knownCollections();
        Map<String, ExportSnapshot.CollectionExport> exported = new LinkedHashMap<>();
        CompletableFuture<Void> run = CompletableFuture.completedFuture(null);
        for (String target : targets) {
            run = run.thenCompose(v -> query(target)
                .thenAccept(items -> exported.put(target, new ExportSnapshot.CollectionExport(items))));
        }
        return run.thenApply(v -> new ExportSnapshot(Instant.now(clock).toString(), activeName(), exported));
    }

    /**
     * @return user collections this service has seen, sorted, without internal ones
     */
    public List<String> knownCollections() {
        Set<String> names = new TreeSet<>(knownCollections);
        for (String key : cache.keys()) {
            String collection = RecordKeys.collectionOf(key);
            if (collection != null) {
                names.add(collection);
            }
        }
        names.removeAll(INTERNAL_COLLECTIONS);
        return new ArrayList<>(names);
    }

    // ---------------------------------------------------------------- sync

    /**
     * Replays pending writes against the active backend. Skipped while offline or while
     * another drain is running.
     */
    public CompletableFuture<DrainResult> drainSyncQueue() {
        return syncQueue.drain(this::replay, isOnline()).thenApply(result -> {
            for (SyncQueueItem item : result.getDropped()) {
                publish(PersistenceEventType.SYNC_ITEM_DROPPED, attributes(
                    "operation", item.getOperation().name().toLowerCase(),
                    "collection", item.getCollection(),
                    "key", item.getKey(),
                    "attempts", item.getAttempts()));
            }
            if (result.hasActivity()) {
                publish(PersistenceEventType.SYNC_COMPLETED, attributes(
                    "processed", result.getProcessed(),
                    "failed", result.getDropped().size(),
                    "remaining", result.getRemaining()));
            }
            return result;
        });
    }

    private CompletableFuture<Void> replay(SyncQueueItem item) {
        StorageBackend backend = active;
        if (backend == null) {
            return CompletableFuture.failedFuture(notInitialized());
        }
        if (!backend.isAvailable()) {
            backend = handleBackendFailure(backend.kind()).orElse(backend);
            if (!backend.isAvailable()) {
                return CompletableFuture.failedFuture(
                    new BackendUnavailableException(backend.kind(), "No backend available for sync"));
            }
        }
        StorageBackend target = backend;
        Supplier<CompletableFuture<Void>> operation;
        switch (item.getOperation()) {
            case SAVE:
                operation = () -> target.save(item.getCollection(), item.getKey(), item.getRecord());
                break;
            case DELETE:
                operation = () -> target.delete(item.getCollection(), item.getKey());
                break;
            default:
                throw new IllegalStateException("Unknown sync operation " + item.getOperation());
        }
        return safely(operation).whenComplete((v, error) -> {
            if (error != null) {
                handleBackendFailure(target.kind());
            }
        });
    }

    private void syncTick() {
        try {
            if (isOnline() && syncQueue.size() > 0) {
                drainSyncQueue();
            }
        } catch (RuntimeException e) {
            logger.error("Scheduled sync failed", e);
        }
    }

    private void onConnectivityChanged(boolean online) {
        if (online) {
            logger.info("Connection restored");
            try {
                determineActiveBackend();
            } catch (PersistenceInitializationException e) {
                logger.error("Back online but no backend is available", e);
            }
            drainSyncQueue().whenComplete((result, error) -> {
                if (error != null) {
                    logger.error("Sync after reconnect failed", error);
                }
            });
            publish(PersistenceEventType.ONLINE, Map.of());
        } else {
            logger.info("Offline mode enabled");
            publish(PersistenceEventType.OFFLINE, Map.of());
        }
    }

    // ---------------------------------------------------------------- persistent cache

    /**
     * Saves the cached {@code system} and {@code config} entries as one compressed record so
     * the next start can warm the cache from it.
     *
     * @return a future completing with true if a snapshot was written
     */
    public CompletableFuture<Boolean> flushPersistentCache() {
        if (!config.isPersistentCacheEnabled() || !cache.isEnabled() || active == null) {
            return CompletableFuture.completedFuture(false);
        }
        Map<String, CacheEntry> entries = cache.snapshot(PersistenceService::isPersistentCacheKey);
        ObjectNode snapshot = RecordSerializer.mapper().createObjectNode();
        entries.forEach((key, entry) -> snapshot.set(key, RecordSerializer.toTree(entry.getData())));
        return store(SYSTEM_COLLECTION, PERSISTENT_CACHE_KEY, snapshot,
                SaveOptions.infiniteTtl().withCompression(CompressionMode.ALWAYS))
            .whenComplete((ok, error) -> {
                if (error != null) {
                    logger.warn("Failed to save persistent cache", error);
                } else {
                    logger.debug("Persistent cache saved: {} entries", entries.size());
                }
            });
    }

    private CompletableFuture<Void> restorePersistentCache() {
        if (!config.isPersistentCacheEnabled() || !cache.isEnabled()) {
            return CompletableFuture.completedFuture(null);
        }
        return fetch(SYSTEM_COLLECTION, PERSISTENT_CACHE_KEY, LoadOptions.FORCE_REFRESH)
            .thenAccept(node -> node.filter(JsonNode::isObject).ifPresent(snapshot -> {
                int restored = 0;
                for (Iterator<Map.Entry<String, JsonNode>> it = snapshot.fields(); it.hasNext(); ) {
                    Map.Entry<String, JsonNode> field = it.next();
                    try {
                        cache.put(field.getKey(), RecordSerializer.fromTree(field.getValue(), field.getKey()), null);
                        restored++;
                    } catch (CorruptedRecordException e) {
                        logger.warn("Skipping unreadable persistent cache entry {}", field.getKey());
                    }
                }
                logger.info("Persistent cache restored: {} entries", restored);
            }))
            .exceptionally(error -> {
                logger.warn("Failed to restore persistent cache", error);
                return null;
            });
    }

    private void persistentCacheTick() {
        try {
            flushPersistentCache();
        } catch (RuntimeException e) {
            logger.error("Scheduled persistent cache flush failed", e);
        }
    }

    /**
     * @throws IllegalArgumentException if {@code collection} is invalid or one the service
     *         keeps its own state in
     */
    private static String requireUserCollection(String collection) {
        RecordKeys.requireCollection(collection);
        if (INTERNAL_COLLECTIONS.contains(collection)) {
            throw new IllegalArgumentException("Collection is reserved: " + collection);
        }
        return collection;
    }

    private static boolean isPersistentCacheKey(String key) {
        return !key.equals(PERSISTENT_CACHE_FULL_KEY)
            && PERSISTENT_CACHE_PREFIXES.stream().anyMatch(key::startsWith);
    }

    // ---------------------------------------------------------------- migration

    /**
     * Imports legacy flat-store entries into the migration collection with infinite TTL.
     * Safe to repeat: target keys are deterministic.
     *
     * @return the import report; {@link MigrationReport#EMPTY} when no flat tier is configured
     *         or the import failed
     */
    public CompletableFuture<MigrationReport> migrateOldData() {
        if (migrationImporter == null) {
            logger.debug("No flat store configured, nothing to migrate");
            return CompletableFuture.completedFuture(MigrationReport.EMPTY);
        }
        if (active == null) {
            return CompletableFuture.failedFuture(notInitialized());
        }
        return migrationImporter.migrate((collection, key, value) -> save(collection, key, value, SaveOptions.infiniteTtl()))
            .thenApply(report -> {
                if (report.getMigrated() > 0) {
                    publish(PersistenceEventType.MIGRATION_COMPLETED, attributes(
                        "migrated", report.getMigrated(), "failed", report.getFailed()));
                }
                return report;
            })
            .exceptionally(error -> {
                logger.error("Legacy migration failed", error);
                return MigrationReport.EMPTY;
            });
    }

    // ---------------------------------------------------------------- introspection

    public PersistenceStats getStats() {
        return new PersistenceStats(
            initialized,
            isOnline(),
            activeName(),
            availableBackendNames(),
            new PersistenceStats.CacheStats(cache.size(), cache.isEnabled(), cache.getTtl().toMillis()),
            new PersistenceStats.SyncStats(syncQueue.size(), syncQueue.isDraining(), config.getSyncInterval().toMillis()),
            new PersistenceStats.CompressionSummary(codec.stats()));
    }

    public Diagnostics diagnose() {
        Map<String, Diagnostics.BackendState> backends = new LinkedHashMap<>();
        for (StorageBackend backend : chain.all()) {
            Map<String, Object> described;
            try {
                described = backend.describe();
            } catch (RuntimeException e) {
                described = Map.of("error", String.valueOf(e.getMessage()));
            }
            backends.put(backend.name(), new Diagnostics.BackendState(backend.isAvailable(), described));
        }
        return new Diagnostics(getStats(), backends, cache.size(), cache.keys(), syncQueue.items());
    }

    public boolean isOnline() {
        return connectivity.isOnline();
    }

    public boolean isInitialized() {
        return initialized;
    }

    public Optional<BackendKind> getActiveBackend() {
        StorageBackend current = active;
        return current == null ? Optional.empty() : Optional.of(current.kind());
    }

    public PersistenceConfig getConfig() {
        return config;
    }

    /**
     * @return the bus lifecycle events are published on
     */
    public PersistenceEventBus events() {
        return eventBus;
    }

    SyncQueue syncQueue() {
        return syncQueue;
    }

    RecordCache cache() {
        return cache;
    }

    // ---------------------------------------------------------------- helpers

    private List<StorageBackend> candidates(StorageBackend primary) {
        List<StorageBackend> ordered = new ArrayList<>();
        ordered.add(primary);
        ordered.addAll(chain.others(primary));
        return ordered;
    }

    /**
     * Runs {@code operation} against each available candidate in turn until one result is
     * accepted. A failure on the active backend moves the active pointer down the chain.
     */
    private <T> CompletableFuture<Optional<Served<T>>> firstAccepting(
            List<StorageBackend> candidates, String action,
            Function<StorageBackend, CompletableFuture<T>> operation, Predicate<T> accept) {
        return attemptFrom(candidates, 0, action, operation, accept);
    }

    private <T> CompletableFuture<Optional<Served<T>>> attemptFrom(
            List<StorageBackend> candidates, int index, String action,
            Function<StorageBackend, CompletableFuture<T>> operation, Predicate<T> accept) {
        if (index >= candidates.size()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        StorageBackend backend = candidates.get(index);
        if (!backend.isAvailable()) {
            return attemptFrom(candidates, index + 1, action, operation, accept);
        }
        return safely(() -> operation.apply(backend))
            .handle((result, error) -> {
                if (error != null) {
                    logger.warn("{} failed on {}: {}", action, backend.name(), unwrap(error).getMessage());
                    if (backend == active) {
                        handleBackendFailure(backend.kind());
                    }
                    return Optional.<Served<T>>empty();
                }
                return accept.test(result) ? Optional.of(new Served<>(backend.kind(), result)) : Optional.<Served<T>>empty();
            })
            .thenCompose(served -> served.isPresent()
                ? CompletableFuture.completedFuture(served)
                : attemptFrom(candidates, index + 1, action, operation, accept));
    }

    private JsonNode decode(StoredRecord record) {
        JsonNode value = record.getValue() == null ? NullNode.getInstance() : record.getValue();
        if (!record.isCompressed()) {
            return value;
        }
        return codec.decompress(record.getMetadata().getCompressionAlgorithm(), value);
    }

    private Optional<JsonNode> decodeQuietly(StoredRecord record) {
        try {
            return Optional.of(decode(record));
        } catch (CorruptedRecordException e) {
            logger.warn("Skipping undecodable record {}", record.fullKey(), e);
            return Optional.empty();
        }
    }

    private static JsonNode toNode(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof JsonNode) {
            return (JsonNode) value;
        }
        return RecordSerializer.mapper().valueToTree(value);
    }

    private String activeName() {
        StorageBackend current = active;
        return current == null ? null : current.name();
    }

    private List<String> availableBackendNames() {
        return chain.available().stream().map(StorageBackend::name).collect(Collectors.toList());
    }

    private void publish(PersistenceEventType type, Map<String, ?> attributes) {
        eventBus.publish(type, attributes);
    }

    private static Map<String, Object> attributes(Object... keysAndValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }

    private static PersistenceException notInitialized() {
        return new PersistenceException("Persistence service is not initialized");
    }

    private static <T> CompletableFuture<T> safely(Supplier<CompletableFuture<T>> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
               && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static final class Served<T> {
        final BackendKind backend;
        final T value;

        Served(BackendKind backend, T value) {
            this.backend = backend;
            this.value = value;
        }
    }

    public static class Builder {
        private PersistenceConfig config = PersistenceConfig.defaults();
        private final List<StorageBackend> backends = new ArrayList<>();
        private ConnectivityMonitor connectivity;
        private CompressionCodec codec;
        private PersistenceEventBus eventBus;
        private SyncQueueStore syncQueueStore;
        private Clock clock = Clock.systemUTC();

        public Builder config(PersistenceConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder backend(StorageBackend backend) {
            backends.add(Objects.requireNonNull(backend, "backend"));
            return this;
        }

        /**
         * Adds the standard chain under {@code baseDirectory}: etcd (when {@code etcdConfig}
         * is given), LMDB in {@code lmdb/}, the flat store in {@code flat/} and memory. With
         * etcd present and no monitor set, connectivity follows the etcd probe.
         */
        public Builder defaultBackends(Path baseDirectory, EtcdBackendConfig etcdConfig) {
            if (etcdConfig != null) {
                EtcdStorageBackend remote = new EtcdStorageBackend(etcdConfig);
                backends.add(remote);
                if (connectivity == null) {
                    connectivity = new ProbingConnectivityMonitor(remote::probe, DEFAULT_PROBE_INTERVAL);
                }
            }
            backends.add(new LmdbStorageBackend(LmdbConfig.builder().dbPath(baseDirectory.resolve("lmdb")).build()));
            backends.add(new FlatStorageBackend(FlatStoreConfig.builder(baseDirectory.resolve("flat")).build()));
            backends.add(new InMemoryStorageBackend());
            return this;
        }

        public Builder connectivity(ConnectivityMonitor connectivity) {
            this.connectivity = connectivity;
            return this;
        }

        public Builder codec(CompressionCodec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Publishes to an external bus. The service does not close a bus it did not create.
         */
        public Builder eventBus(PersistenceEventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        /**
         * Overrides where the sync queue is persisted. Defaults to the flat tier's store, or
         * nowhere if there is no flat tier.
         */
        public Builder syncQueueStore(SyncQueueStore store) {
            this.syncQueueStore = store;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public PersistenceService build() {
            return new PersistenceService(this);
        }
    }
}
