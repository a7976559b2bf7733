package com.stratasystems.persistence.lmdb;

import com.stratasystems.persistence.StorageException;
import com.stratasystems.persistence.StorageException.TransactionFailedException;
import org.lmdbjava.Dbi;
import org.lmdbjava.DbiFlags;
import org.lmdbjava.Env;
import org.lmdbjava.EnvFlags;
import org.lmdbjava.Txn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Owns the LMDB environment of the embedded tier and its single record database.
 *
 * <p>Every transaction runs under the shared side of a lock and {@link #close()} takes the
 * exclusive side, so the memory map is never unmapped under a live transaction.
 */
public class LmdbEnvironmentManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LmdbEnvironmentManager.class);

    static final String RECORDS_DATABASE = "records";

    /**
     * Work done inside one transaction.
     */
    @FunctionalInterface
    public interface TxnWork<T> {
        T apply(Txn<ByteBuffer> txn) throws Exception;
    }

    private final LmdbConfig config;
    private final Env<ByteBuffer> env;
    private final Dbi<ByteBuffer> records;
    private final ReadWriteLock lifecycle = new ReentrantReadWriteLock();
    private volatile boolean closed = false;

    private final AtomicLong reads = new AtomicLong();
    private final AtomicLong writes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();

    /**
     * Creates the directory if needed and opens the environment.
     *
     * @throws IOException if the directory cannot be created
     */
    public LmdbEnvironmentManager(LmdbConfig config) throws IOException {
        this.config = config;
        Files.createDirectories(config.getDbPath());
        EnvFlags[] flags = config.isNoSync() ? new EnvFlags[]{EnvFlags.MDB_NOSYNC} : new EnvFlags[0];
        this.env = Env.create()
            .setMapSize(config.getMapSize())
            .setMaxDbs(1)
            .setMaxReaders(config.getMaxReaders())
            .open(config.getDbPath().toFile(), flags);
        this.records = env.openDbi(RECORDS_DATABASE, DbiFlags.MDB_CREATE);
        logger.info("LMDB environment opened at {} (map size {} bytes)", config.getDbPath(), config.getMapSize());
    }

    public Dbi<ByteBuffer> records() {
        return records;
    }

    public <T> T read(TxnWork<T> work) {
        return inTransaction(false, work);
    }

    /**
     * Runs {@code work} in a write transaction and commits it. A failed transaction is
     * attempted again, up to {@link LmdbConfig#getMaxRetries()} attempts in total.
     * {@link StorageException}s raised by {@code work} itself are not retried.
     */
    public <T> T write(TxnWork<T> work) {
        TransactionFailedException last = null;
        for (int attempt = 1; attempt <= config.getMaxRetries(); attempt++) {
            try {
                return inTransaction(true, work);
            } catch (TransactionFailedException e) {
                last = e;
                if (closed || attempt == config.getMaxRetries()) {
                    break;
                }
                retries.incrementAndGet();
                logger.warn("LMDB write failed on attempt {} of {}, retrying", attempt, config.getMaxRetries(), e);
                pause();
            }
        }
        throw new TransactionFailedException("LMDB write failed after " + config.getMaxRetries() + " attempts", last);
    }

    private <T> T inTransaction(boolean write, TxnWork<T> work) {
        lifecycle.readLock().lock();
        try {
            if (closed) {
                throw new IllegalStateException("LMDB environment is closed");
            }
            try (Txn<ByteBuffer> txn = write ? env.txnWrite() : env.txnRead()) {
                T result = work.apply(txn);
                if (write) {
                    txn.commit();
                    writes.incrementAndGet();
                } else {
                    reads.incrementAndGet();
                }
                return result;
            }
        } catch (StorageException | IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            failures.incrementAndGet();
            throw new TransactionFailedException((write ? "Write" : "Read") + " transaction failed", e);
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    /**
     * Encodes a record key into a direct buffer.
     *
     * @throws StorageException if the key is longer than LMDB allows
     */
    public ByteBuffer key(String key) {
        byte[] bytes = key.getBytes(UTF_8);
        int max = env.getMaxKeySize();
        if (bytes.length > max) {
            throw new StorageException("Key exceeds LMDB maximum key size (" + max + " bytes): " + key);
        }
        ByteBuffer buffer = ByteBuffer.allocateDirect(bytes.length);
        buffer.put(bytes).flip();
        return buffer;
    }

    public long entryCount() {
        return read(txn -> records.stat(txn).entries);
    }

    /**
     * @return transaction counters since the environment was opened
     */
    public Map<String, Long> counters() {
        Map<String, Long> counters = new LinkedHashMap<>();
        counters.put("reads", reads.get());
        counters.put("writes", writes.get());
        counters.put("failedTransactions", failures.get());
        counters.put("retriedTransactions", retries.get());
        return counters;
    }

    public boolean isClosed() {
        return closed;
    }

    public LmdbConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        lifecycle.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            env.close();
            logger.info("LMDB environment at {} closed, counters {}", config.getDbPath(), counters());
        } finally {
            lifecycle.writeLock().unlock();
        }
    }

    private void pause() {
        try {
            Thread.sleep(config.getRetryDelay().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransactionFailedException("Interrupted between LMDB write attempts", e);
        }
    }
}
