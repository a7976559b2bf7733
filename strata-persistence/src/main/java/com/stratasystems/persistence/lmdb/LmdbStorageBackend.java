package com.stratasystems.persistence.lmdb;

import com.stratasystems.persistence.BackendKind;
import com.stratasystems.persistence.QueryOptions;
import com.stratasystems.persistence.RecordKeys;
import com.stratasystems.persistence.StorageBackend;
import com.stratasystems.persistence.StorageException.BackendUnavailableException;
import com.stratasystems.persistence.StorageException.CorruptedRecordException;
import com.stratasystems.persistence.StorageException.RecordTooLargeException;
import com.stratasystems.persistence.StoredRecord;
import com.stratasystems.persistence.codec.RecordSerializer;
import org.lmdbjava.Cursor;
import org.lmdbjava.GetOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
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

import static java.nio.ByteBuffer.allocateDirect;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Embedded tier backed by a memory-mapped LMDB environment.
 *
 * <p>Key format: {@code "collection:key"} in the environment's single record database.
 * Value format: the JSON envelope written by {@link RecordSerializer}. Keys sort
 * lexicographically, so a collection is a contiguous range and query or clear is one
 * cursor scan starting at {@code "collection:"}.
 *
 * <p>All LMDB calls run on a small daemon I/O pool; every transaction is opened and
 * closed inside a single task.
 */
public class LmdbStorageBackend implements StorageBackend {
    private static final Logger logger = LoggerFactory.getLogger(LmdbStorageBackend.class);

    private final LmdbConfig config;
    private final ExecutorService ioExecutor;
    private volatile LmdbEnvironmentManager envManager;
    private volatile boolean closed = false;

    public LmdbStorageBackend(LmdbConfig config) {
        this.config = config;
        this.ioExecutor = Executors.newFixedThreadPool(config.getIoThreads(), r -> {
            Thread t = new Thread(r, "lmdb-backend-io");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public BackendKind kind() {
        return BackendKind.EMBEDDED;
    }

    @Override
    public boolean isAvailable() {
        LmdbEnvironmentManager manager = envManager;
        return !closed && manager != null && !manager.isClosed();
    }

    @Override
    public CompletableFuture<Void> open() {
        if (closed) {
            return CompletableFuture.failedFuture(unavailable("Backend is closed", null));
        }
        return CompletableFuture.runAsync(() -> {
            if (envManager != null) {
                return;
            }
            try {
                envManager = new LmdbEnvironmentManager(config);
            } catch (IOException | RuntimeException | UnsatisfiedLinkError e) {
                logger.warn("LMDB environment at {} could not be opened", config.getDbPath(), e);
                throw unavailable("Failed to open LMDB environment at " + config.getDbPath(), e);
            }
        }, ioExecutor);
    }

    @Override
    public CompletableFuture<Void> save(String collection, String key, StoredRecord record) {
        String fullKey = RecordKeys.fullKey(collection, key);
        return submit(() -> {
            LmdbEnvironmentManager manager = requireOpen();
            byte[] valueBytes = RecordSerializer.toBytes(record);
            if (valueBytes.length > config.getMaxValueSize()) {
                throw new RecordTooLargeException(valueBytes.length, config.getMaxValueSize());
            }
            ByteBuffer keyBuf = manager.key(fullKey);
            ByteBuffer valBuf = allocateDirect(valueBytes.length);
            valBuf.put(valueBytes).flip();

            manager.write(txn -> manager.records().put(txn, keyBuf, valBuf));
            logger.debug("Saved {} ({} bytes)", fullKey, valueBytes.length);
            return null;
        });
    }

    @Override
    public CompletableFuture<Optional<StoredRecord>> load(String collection, String key) {
        String fullKey = RecordKeys.fullKey(collection, key);
        return submit(() -> {
            LmdbEnvironmentManager manager = requireOpen();
            ByteBuffer keyBuf = manager.key(fullKey);
            byte[] bytes = manager.read(txn -> {
                ByteBuffer found = manager.records().get(txn, keyBuf);
                return found == null ? null : copy(found);
            });
            if (bytes == null) {
                return Optional.empty();
            }
            return parse(fullKey, bytes);
        });
    }

    @Override
    public CompletableFuture<Void> delete(String collection, String key) {
        String fullKey = RecordKeys.fullKey(collection, key);
        return submit(() -> {
            LmdbEnvironmentManager manager = requireOpen();
            ByteBuffer keyBuf = manager.key(fullKey);
            boolean deleted = manager.write(txn -> manager.records().delete(txn, keyBuf));
            logger.debug("Deleted {} (present: {})", fullKey, deleted);
            return null;
        });
    }

    @Override
    public CompletableFuture<List<StoredRecord>> query(String collection, Predicate<StoredRecord> filter,
                                                       QueryOptions options) {
        String prefix = RecordKeys.requireCollection(collection) + RecordKeys.SEPARATOR;
        return submit(() -> {
            LmdbEnvironmentManager manager = requireOpen();
            Map<String, byte[]> raw = manager.read(txn -> {
                Map<String, byte[]> entries = new LinkedHashMap<>();
                try (Cursor<ByteBuffer> cursor = manager.records().openCursor(txn)) {
                    if (cursor.get(manager.key(prefix), GetOp.MDB_SET_RANGE)) {
                        do {
                            String currentKey = UTF_8.decode(cursor.key()).toString();
                            if (!currentKey.startsWith(prefix)) {
                                break;
                            }
                            entries.put(currentKey, copy(cursor.val()));
                        } while (cursor.next());
                    }
                }
                return entries;
            });

            List<StoredRecord> results = new ArrayList<>();
            for (Map.Entry<String, byte[]> entry : raw.entrySet()) {
                Optional<StoredRecord> record = parse(entry.getKey(), entry.getValue());
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
            LmdbEnvironmentManager manager = requireOpen();
            if (collection == null) {
                manager.write(txn -> {
                    manager.records().drop(txn);
                    return null;
                });
                logger.info("Cleared all embedded records");
                return null;
            }
            String prefix = RecordKeys.requireCollection(collection) + RecordKeys.SEPARATOR;
            int removed = manager.write(txn -> {
                int count = 0;
                try (Cursor<ByteBuffer> cursor = manager.records().openCursor(txn)) {
                    if (cursor.get(manager.key(prefix), GetOp.MDB_SET_RANGE)) {
                        do {
                            String currentKey = UTF_8.decode(cursor.key()).toString();
                            if (!currentKey.startsWith(prefix)) {
                                break;
                            }
                            cursor.delete();
                            count++;
                        } while (cursor.next());
                    }
                }
                return count;
            });
            logger.info("Cleared {} embedded records from collection {}", removed, collection);
            return null;
        });
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("available", isAvailable());
        stats.put("path", config.getDbPath().toString());
        LmdbEnvironmentManager manager = envManager;
        if (isAvailable()) {
            try {
                stats.put("entries", manager.entryCount());
                stats.putAll(manager.counters());
            } catch (RuntimeException e) {
                logger.debug("Could not read LMDB statistics", e);
                stats.put("error", e.getMessage());
            }
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
        LmdbEnvironmentManager manager = envManager;
        if (manager != null) {
            manager.close();
        }
        logger.info("LMDB backend closed");
    }

    private <T> CompletableFuture<T> submit(IoTask<T> task) {
        if (closed) {
            return CompletableFuture.failedFuture(unavailable("Backend is closed", null));
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
            future.completeExceptionally(unavailable("Backend is shutting down", e));
        }
        return future;
    }

    private LmdbEnvironmentManager requireOpen() {
        LmdbEnvironmentManager manager = envManager;
        if (manager == null || manager.isClosed()) {
            throw unavailable("LMDB environment is not open", null);
        }
        return manager;
    }

    private Optional<StoredRecord> parse(String fullKey, byte[] bytes) {
        try {
            return Optional.of(RecordSerializer.fromBytes(bytes, fullKey));
        } catch (CorruptedRecordException e) {
            logger.warn("Skipping corrupted embedded record {}", fullKey, e);
            return Optional.empty();
        }
    }

    private static byte[] copy(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }

    private BackendUnavailableException unavailable(String message, Throwable cause) {
        return cause == null
            ? new BackendUnavailableException(BackendKind.EMBEDDED, message)
            : new BackendUnavailableException(BackendKind.EMBEDDED, message, cause);
    }

    @FunctionalInterface
    private interface IoTask<T> {
        T run() throws Exception;
    }
}
