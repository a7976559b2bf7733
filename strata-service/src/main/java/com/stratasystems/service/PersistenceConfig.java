package com.stratasystems.service;

import java.time.Duration;
import java.util.List;

/**
 * Tuning for {@link PersistenceService}.
 *
 * <p>When no default record TTL is set, records saved without an explicit TTL get the
 * cache TTL.
 */
public class PersistenceConfig {

    public static final String DEFAULT_MIGRATION_COLLECTION = "migrated_legacy";
    public static final List<String> DEFAULT_LEGACY_PREFIXES = List.of("kc_", "KC_");

    private boolean cacheEnabled = true;
    private Duration cacheTtl = Duration.ofMinutes(5);
    private int cacheMaxEntries = 10_000;
    private Duration cacheSweepInterval = Duration.ofMinutes(5);

    private boolean persistentCacheEnabled = true;
    private Duration persistentCacheInterval = Duration.ofMinutes(10);

    private Duration syncInterval = Duration.ofSeconds(30);
    private int syncMaxAttempts = 3;

    private boolean compressionEnabled = true;
    private int compressionThreshold = 1024;

    private Duration defaultTtl;

    private boolean migrationEnabled = true;
    private List<String> legacyPrefixes = DEFAULT_LEGACY_PREFIXES;
    private String migrationCollection = DEFAULT_MIGRATION_COLLECTION;

    public static PersistenceConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isCacheEnabled() { return cacheEnabled; }
    public Duration getCacheTtl() { return cacheTtl; }
    public int getCacheMaxEntries() { return cacheMaxEntries; }
    public Duration getCacheSweepInterval() { return cacheSweepInterval; }
    public boolean isPersistentCacheEnabled() { return persistentCacheEnabled; }
    public Duration getPersistentCacheInterval() { return persistentCacheInterval; }
    public Duration getSyncInterval() { return syncInterval; }
    public int getSyncMaxAttempts() { return syncMaxAttempts; }
    public boolean isCompressionEnabled() { return compressionEnabled; }
    public int getCompressionThreshold() { return compressionThreshold; }
    public boolean isMigrationEnabled() { return migrationEnabled; }
    public List<String> getLegacyPrefixes() { return legacyPrefixes; }
    public String getMigrationCollection() { return migrationCollection; }

    /**
     * @return the TTL given to records saved without one
     */
    public Duration getDefaultTtl() {
        return defaultTtl != null ? defaultTtl : cacheTtl;
    }

    @Override
    public String toString() {
        return "PersistenceConfig{" +
               "cacheEnabled=" + cacheEnabled +
               ", cacheTtl=" + cacheTtl +
               ", cacheMaxEntries=" + cacheMaxEntries +
               ", persistentCache=" + (persistentCacheEnabled ? persistentCacheInterval : "off") +
               ", syncInterval=" + syncInterval +
               ", syncMaxAttempts=" + syncMaxAttempts +
               ", compression=" + (compressionEnabled ? ">=" + compressionThreshold + "B" : "off") +
               ", defaultTtl=" + getDefaultTtl() +
               ", migration=" + (migrationEnabled ? legacyPrefixes + "->" + migrationCollection : "off") +
               '}';
    }

    public static class Builder {
        private final PersistenceConfig config = new PersistenceConfig();

        public Builder cacheEnabled(boolean enabled) {
            config.cacheEnabled = enabled;
            return this;
        }

        public Builder cacheTtl(Duration ttl) {
            config.cacheTtl = ttl;
            return this;
        }

        public Builder cacheMaxEntries(int max) {
            config.cacheMaxEntries = max;
            return this;
        }

        public Builder cacheSweepInterval(Duration interval) {
            config.cacheSweepInterval = interval;
            return this;
        }

        public Builder persistentCacheEnabled(boolean enabled) {
            config.persistentCacheEnabled = enabled;
            return this;
        }

        public Builder persistentCacheInterval(Duration interval) {
            config.persistentCacheInterval = interval;
            return this;
        }

        public Builder syncInterval(Duration interval) {
            config.syncInterval = interval;
            return this;
        }

        public Builder syncMaxAttempts(int attempts) {
            config.syncMaxAttempts = attempts;
            return this;
        }

        public Builder compressionEnabled(boolean enabled) {
            config.compressionEnabled = enabled;
            return this;
        }

        /**
         * Values whose JSON form is smaller than this many bytes are never compressed.
         */
        public Builder compressionThreshold(int bytes) {
            config.compressionThreshold = bytes;
            return this;
        }

        public Builder defaultTtl(Duration ttl) {
            config.defaultTtl = ttl;
            return this;
        }

        public Builder migrationEnabled(boolean enabled) {
            config.migrationEnabled = enabled;
            return this;
        }

        public Builder legacyPrefixes(List<String> prefixes) {
            config.legacyPrefixes = prefixes == null ? null : List.copyOf(prefixes);
            return this;
        }

        public Builder migrationCollection(String collection) {
            config.migrationCollection = collection;
            return this;
        }

        public PersistenceConfig build() {
            config.validate();
            return config;
        }
    }

    private void validate() {
        requirePositive(cacheTtl, "Cache TTL");
        requirePositive(cacheSweepInterval, "Cache sweep interval");
        requirePositive(persistentCacheInterval, "Persistent cache interval");
        requirePositive(syncInterval, "Sync interval");
        if (cacheMaxEntries <= 0) {
            throw new IllegalArgumentException("Cache max entries must be positive");
        }
        if (syncMaxAttempts <= 0) {
            throw new IllegalArgumentException("Sync max attempts must be positive");
        }
        if (compressionThreshold < 0) {
            throw new IllegalArgumentException("Compression threshold cannot be negative");
        }
        if (defaultTtl != null && defaultTtl.isNegative()) {
            throw new IllegalArgumentException("Default TTL cannot be negative");
        }
        if (legacyPrefixes == null || legacyPrefixes.isEmpty() || legacyPrefixes.stream().anyMatch(String::isEmpty)) {
            throw new IllegalArgumentException("Legacy prefixes must be non-empty strings");
        }
        if (migrationCollection == null || migrationCollection.isBlank()) {
            throw new IllegalArgumentException("Migration collection cannot be blank");
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
