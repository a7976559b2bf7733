package com.stratasystems.persistence.etcd;

import com.stratasystems.persistence.BackendKind;
import com.stratasystems.persistence.QueryOptions;
import com.stratasystems.persistence.RecordKeys;
import com.stratasystems.persistence.StorageBackend;
import com.stratasystems.persistence.StorageException.BackendUnavailableException;
import com.stratasystems.persistence.StorageException.CorruptedRecordException;
import com.stratasystems.persistence.StoredRecord;
import com.stratasystems.persistence.codec.RecordSerializer;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.options.DeleteOption;
import io.etcd.jetcd.options.GetOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Remote tier backed by an etcd cluster.
 *
 * <p>Key format: {@code <keyPrefix><collection>:<key>}; value is the record envelope as
 * JSON. Every request is bounded by the configured timeout. A failed or timed out request
 * marks the backend unhealthy, which takes it out of the fallback chain until
 * {@link #probe()} succeeds again.
 */
public class EtcdStorageBackend implements StorageBackend {
    private static final Logger logger = LoggerFactory.getLogger(EtcdStorageBackend.class);

    private final EtcdBackendConfig config;
    private final Supplier<Client> clientFactory;
    private final AtomicBoolean healthy = new AtomicBoolean(false);
    private volatile Client client;
    private volatile boolean closed = false;
    private volatile String lastError;

    public EtcdStorageBackend(EtcdBackendConfig config) {
        this(config, () -> Client.builder()
            .endpoints(config.getEndpoints().toArray(new String[0]))
            .build());
    }

    public EtcdStorageBackend(EtcdBackendConfig config, Supplier<Client> clientFactory) {
        this.config = config;
        this.clientFactory = clientFactory;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.REMOTE;
    }

    @Override
    public boolean isAvailable() {
        return !closed && client != null && healthy.get();
    }

    @Override
    public CompletableFuture<Void> open() {
        if (closed) {
            return CompletableFuture.failedFuture(new BackendUnavailableException(kind(), "Backend is closed"));
        }
        if (client == null) {
            try {
                client = clientFactory.get();
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                logger.warn("Could not create etcd client for {}", config.getEndpoints(), e);
                return CompletableFuture.failedFuture(
                    new BackendUnavailableException(kind(), "Failed to create etcd client", e));
            }
        }
        return probe().thenAccept(ok -> {
            if (!ok) {
                throw new BackendUnavailableException(kind(), "etcd at " + config.getEndpoints() + " is unreachable");
            }
            logger.info("Connected to etcd at {}", config.getEndpoints());
        });
    }

    /**
     * Issues a count-only read under the key prefix and records the outcome as the
     * backend's health. Never completes exceptionally.
     *
     * @return true if etcd answered within the request timeout
     */
    public CompletableFuture<Boolean> probe() {
        Client current = client;
        if (closed || current == null) {
            return CompletableFuture.completedFuture(false);
        }
        GetOption countOnly = GetOption.builder().isPrefix(true).withCountOnly(true).build();
        CompletableFuture<Boolean> result;
        try {
            result = current.getKVClient().get(bytes(config.getKeyPrefix()), countOnly)
                .orTimeout(config.getRequestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(response -> true);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.exceptionally(ex -> {
            lastError = unwrap(ex).toString();
            logger.debug("etcd probe failed: {}", lastError);
            return false;
        }).thenApply(ok -> {
            boolean was = healthy.getAndSet(ok);
            if (ok && !was) {
                lastError = null;
                logger.info("etcd backend is healthy");
            }
            return ok;
        });
    }

    @Override
    public CompletableFuture<Void> save(String collection, String key, StoredRecord record) {
        ByteSequence etcdKey = bytes(etcdKey(collection, key));
        byte[] value = RecordSerializer.toBytes(record);
        return call("put", kv -> kv.put(etcdKey, ByteSequence.from(value)))
            .thenApply(response -> null);
    }

    @Override
    public CompletableFuture<Optional<StoredRecord>> load(String collection, String key) {
        String rawKey = etcdKey(collection, key);
        return call("get", kv -> kv.get(bytes(rawKey)))
            .thenApply(response -> {
                if (response.getKvs().isEmpty()) {
                    return Optional.empty();
                }
                return parse(rawKey, response.getKvs().get(0));
            });
    }

    @Override
    public CompletableFuture<Void> delete(String collection, String key) {
        ByteSequence etcdKey = bytes(etcdKey(collection, key));
        return call("delete", kv -> kv.delete(etcdKey))
            .thenApply(response -> null);
    }

    @Override
    public CompletableFuture<List<StoredRecord>> query(String collection, Predicate<StoredRecord> filter,
                                                       QueryOptions options) {
        String prefix = collectionPrefix(collection);
        GetOption option = GetOption.builder().isPrefix(true).build();
        return call("range", kv -> kv.get(bytes(prefix), option))
            .thenApply(response -> {
                List<StoredRecord> results = new ArrayList<>();
                for (KeyValue entry : response.getKvs()) {
                    String rawKey = entry.getKey().toString(StandardCharsets.UTF_8);
                    Optional<StoredRecord> record = parse(rawKey, entry);
                    if (record.isPresent() && filter.test(record.get())) {
                        results.add(record.get());
                    }
                }
                results.sort((a, b) -> a.fullKey().compareTo(b.fullKey()));
                if (options.hasLimit() && results.size() > options.getLimit()) {
                    return new ArrayList<>(results.subList(0, options.getLimit()));
                }
                return results;
            });
    }

    @Override
    public CompletableFuture<Void> clear(String collection) {
        String prefix = collection == null ? config.getKeyPrefix() : collectionPrefix(collection);
        DeleteOption option = DeleteOption.builder().isPrefix(true).build();
        return call("delete-range", kv -> kv.delete(bytes(prefix), option))
            .thenAccept(response -> logger.info("Cleared {} remote records under {}", response.getDeleted(), prefix));
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("available", isAvailable());
        stats.put("endpoints", config.getEndpoints());
        stats.put("keyPrefix", config.getKeyPrefix());
        stats.put("healthy", healthy.get());
        if (lastError != null) {
            stats.put("lastError", lastError);
        }
        return stats;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        healthy.set(false);
        Client current = client;
        client = null;
        if (current != null) {
            current.close();
        }
        logger.info("etcd backend closed");
    }

    private <T> CompletableFuture<T> call(String operation, Function<KV, CompletableFuture<T>> request) {
        Client current = client;
        if (closed || current == null || !healthy.get()) {
            return CompletableFuture.failedFuture(
                new BackendUnavailableException(kind(), "etcd is not available for " + operation));
        }
        CompletableFuture<T> pending;
        try {
            pending = request.apply(current.getKVClient());
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        pending.orTimeout(config.getRequestTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((value, ex) -> {
                if (ex == null) {
                    result.complete(value);
                    return;
                }
                Throwable cause = unwrap(ex);
                markUnhealthy(operation, cause);
                String reason = cause instanceof TimeoutException
                    ? operation + " timed out after " + config.getRequestTimeout()
                    : operation + " failed";
                result.completeExceptionally(new BackendUnavailableException(kind(), reason, cause));
            });
        return result;
    }

    private void markUnhealthy(String operation, Throwable cause) {
        lastError = cause.toString();
        if (healthy.compareAndSet(true, false)) {
            logger.warn("etcd {} failed, marking remote backend unhealthy", operation, cause);
        }
    }

    private Optional<StoredRecord> parse(String rawKey, KeyValue entry) {
        try {
            return Optional.of(RecordSerializer.fromBytes(entry.getValue().getBytes(), rawKey));
        } catch (CorruptedRecordException e) {
            logger.warn("Skipping corrupted remote record {}", rawKey, e);
            return Optional.empty();
        }
    }

    String etcdKey(String collection, String key) {
        RecordKeys.fullKey(collection, key);
        return config.getKeyPrefix() + collection + RecordKeys.SEPARATOR + key;
    }

    private String collectionPrefix(String collection) {
        return config.getKeyPrefix() + RecordKeys.requireCollection(collection) + RecordKeys.SEPARATOR;
    }

    private static ByteSequence bytes(String value) {
        return ByteSequence.from(value, StandardCharsets.UTF_8);
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
