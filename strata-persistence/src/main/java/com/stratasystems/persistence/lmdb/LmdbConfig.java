package com.stratasystems.persistence.lmdb;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings for the embedded tier. Immutable; build with {@link #builder()}.
 *
 * <p>{@code mapSize} caps the size of the database file. The map is sparse, so a large value
 * costs address space only.
 */
public final class LmdbConfig {

    public static final long DEFAULT_MAP_SIZE = 256L * 1024 * 1024;
    public static final int DEFAULT_MAX_VALUE_SIZE = 4 * 1024 * 1024;

    private final Path dbPath;
    private final long mapSize;
    private final int maxReaders;
    private final boolean noSync;
    private final int maxValueSize;
    private final int ioThreads;
    private final int maxRetries;
    private final Duration retryDelay;

    private LmdbConfig(Builder builder) {
        this.dbPath = builder.dbPath;
        this.mapSize = builder.mapSize;
        this.maxReaders = builder.maxReaders;
        this.noSync = builder.noSync;
        this.maxValueSize = builder.maxValueSize;
        this.ioThreads = builder.ioThreads;
        this.maxRetries = builder.maxRetries;
        this.retryDelay = builder.retryDelay;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path getDbPath() { return dbPath; }
    public long getMapSize() { return mapSize; }
    public int getMaxReaders() { return maxReaders; }

    /**
     * @return true if commits skip the fsync; the newest commits may be lost on a crash
     */
    public boolean isNoSync() { return noSync; }

    /**
     * @return the largest serialized record the tier accepts, in bytes
     */
    public int getMaxValueSize() { return maxValueSize; }

    public int getIoThreads() { return ioThreads; }

    /**
     * @return how many times a failed write transaction is attempted in total
     */
    public int getMaxRetries() { return maxRetries; }

    public Duration getRetryDelay() { return retryDelay; }

    @Override
    public String toString() {
        return "LmdbConfig{dbPath=" + dbPath +
               ", mapSize=" + mapSize +
               ", maxValueSize=" + maxValueSize +
               ", noSync=" + noSync +
               ", ioThreads=" + ioThreads +
               ", maxRetries=" + maxRetries +
               '}';
    }

    public static class Builder {
        private Path dbPath = Path.of(System.getProperty("java.io.tmpdir"), "strata", "lmdb");
        private long mapSize = DEFAULT_MAP_SIZE;
        private int maxReaders = 126;
        private boolean noSync = false;
        private int maxValueSize = DEFAULT_MAX_VALUE_SIZE;
        private int ioThreads = 2;
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofMillis(50);

        public Builder dbPath(Path dbPath) {
            this.dbPath = dbPath;
            return this;
        }

        public Builder mapSize(long bytes) {
            this.mapSize = bytes;
            return this;
        }

        public Builder maxReaders(int maxReaders) {
            this.maxReaders = maxReaders;
            return this;
        }

        public Builder noSync(boolean noSync) {
            this.noSync = noSync;
            return this;
        }

        public Builder maxValueSize(int bytes) {
            this.maxValueSize = bytes;
            return this;
        }

        public Builder ioThreads(int threads) {
            this.ioThreads = threads;
            return this;
        }

        public Builder maxRetries(int attempts) {
            this.maxRetries = attempts;
            return this;
        }

        public Builder retryDelay(Duration delay) {
            this.retryDelay = delay;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a setting is out of range
         */
        public LmdbConfig build() {
            if (dbPath == null) {
                throw new IllegalArgumentException("Database path cannot be null");
            }
            if (mapSize <= 0) {
                throw new IllegalArgumentException("Map size must be positive");
            }
            if (maxValueSize <= 0 || maxValueSize > mapSize) {
                throw new IllegalArgumentException("Max value size must be positive and no larger than the map");
            }
            if (maxReaders <= 0 || ioThreads <= 0) {
                throw new IllegalArgumentException("Reader and I/O thread counts must be positive");
            }
            if (maxRetries <= 0) {
                throw new IllegalArgumentException("Max retries must be positive");
            }
            if (retryDelay == null || retryDelay.isNegative()) {
                throw new IllegalArgumentException("Retry delay cannot be negative");
            }
            return new LmdbConfig(this);
        }
    }
}
