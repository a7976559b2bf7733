package com.stratasystems.service;

import com.stratasystems.persistence.codec.CompressionStats;

import java.util.List;

/**
 * Point-in-time view of the service state.
 */
public final class PersistenceStats {

    private final boolean initialized;
    private final boolean online;
    private final String activeBackend;
    private final List<String> availableBackends;
    private final CacheStats cache;
    private final SyncStats sync;
    private final CompressionSummary compression;

    PersistenceStats(boolean initialized, boolean online, String activeBackend, List<String> availableBackends,
                     CacheStats cache, SyncStats sync, CompressionSummary compression) {
        this.initialized = initialized;
        this.online = online;
        this.activeBackend = activeBackend;
        this.availableBackends = List.copyOf(availableBackends);
        this.cache = cache;
        this.sync = sync;
        this.compression = compression;
    }

    public boolean isInitialized() { return initialized; }
    public boolean isOnline() { return online; }
    public String getActiveBackend() { return activeBackend; }
    public List<String> getAvailableBackends() { return availableBackends; }
    public CacheStats getCache() { return cache; }
    public SyncStats getSync() { return sync; }
    public CompressionSummary getCompression() { return compression; }

    @Override
    public String toString() {
        return "PersistenceStats{initialized=" + initialized +
               ", online=" + online +
               ", activeBackend=" + activeBackend +
               ", availableBackends=" + availableBackends +
               ", cache=" + cache.getSize() + "/" + (cache.isEnabled() ? "on" : "off") +
               ", queueSize=" + sync.getQueueSize() +
               '}';
    }

    public static final class CacheStats {
        private final int size;
        private final boolean enabled;
        private final long ttlMillis;

        CacheStats(int size, boolean enabled, long ttlMillis) {
            this.size = size;
            this.enabled = enabled;
            this.ttlMillis = ttlMillis;
        }

        public int getSize() { return size; }
        public boolean isEnabled() { return enabled; }
        public long getTtlMillis() { return ttlMillis; }
    }

    public static final class SyncStats {
        private final int queueSize;
        private final boolean inProgress;
        private final long intervalMillis;

        SyncStats(int queueSize, boolean inProgress, long intervalMillis) {
            this.queueSize = queueSize;
            this.inProgress = inProgress;
            this.intervalMillis = intervalMillis;
        }

        public int getQueueSize() { return queueSize; }
        public boolean isInProgress() { return inProgress; }
        public long getIntervalMillis() { return intervalMillis; }
    }

    public static final class CompressionSummary {
        private final long compressions;
        private final long decompressions;
        private final long bytesSaved;
        private final double ratio;
        private final long errors;

        CompressionSummary(CompressionStats stats) {
            this.compressions = stats.getCompressions();
            this.decompressions = stats.getDecompressions();
            this.bytesSaved = stats.getBytesSaved();
            this.ratio = stats.getCompressionRatio();
            this.errors = stats.getErrors();
        }

        public long getCompressions() { return compressions; }
        public long getDecompressions() { return decompressions; }
        public long getBytesSaved() { return bytesSaved; }
        public double getRatio() { return ratio; }
        public long getErrors() { return errors; }
    }
}
