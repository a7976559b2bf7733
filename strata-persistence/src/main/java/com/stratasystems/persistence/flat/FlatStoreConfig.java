package com.stratasystems.persistence.flat;

import java.nio.file.Path;

/**
 * Configuration for the flat file tier.
 */
public class FlatStoreConfig {

    public static final long DEFAULT_QUOTA_BYTES = 5L * 1024 * 1024;
    public static final String DEFAULT_NAMESPACE_PREFIX = "strata_";

    private final Path directory;
    private final long quotaBytes;
    private final String namespacePrefix;
    private final boolean fsync;
    private final double evictionFraction;

    private FlatStoreConfig(Builder builder) {
        this.directory = builder.directory;
        this.quotaBytes = builder.quotaBytes;
        this.namespacePrefix = builder.namespacePrefix;
        this.fsync = builder.fsync;
        this.evictionFraction = builder.evictionFraction;
    }

    public static Builder builder(Path directory) {
        return new Builder(directory);
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * @return maximum total of key plus value bytes the store accepts
     */
    public long getQuotaBytes() {
        return quotaBytes;
    }

    /**
     * @return prefix of every raw key the storage backend owns
     */
    public String getNamespacePrefix() {
        return namespacePrefix;
    }

    public boolean isFsync() {
        return fsync;
    }

    /**
     * @return share of the backend's records evicted when a write exceeds the quota
     */
    public double getEvictionFraction() {
        return evictionFraction;
    }

    @Override
    public String toString() {
        return "FlatStoreConfig{" +
                "directory=" + directory +
                ", quotaBytes=" + quotaBytes +
                ", namespacePrefix='" + namespacePrefix + '\'' +
                ", fsync=" + fsync +
                ", evictionFraction=" + evictionFraction +
                '}';
    }

    public static class Builder {
        private final Path directory;
        private long quotaBytes = DEFAULT_QUOTA_BYTES;
        private String namespacePrefix = DEFAULT_NAMESPACE_PREFIX;
        private boolean fsync = true;
        private double evictionFraction = 0.25;

        private Builder(Path directory) {
            this.directory = directory;
        }

        public Builder quotaBytes(long quotaBytes) {
            this.quotaBytes = quotaBytes;
            return this;
        }

        public Builder namespacePrefix(String namespacePrefix) {
            this.namespacePrefix = namespacePrefix;
            return this;
        }

        public Builder fsync(boolean fsync) {
            this.fsync = fsync;
            return this;
        }

        public Builder evictionFraction(double evictionFraction) {
            this.evictionFraction = evictionFraction;
            return this;
        }

        public FlatStoreConfig build() {
            if (directory == null) {
                throw new IllegalArgumentException("Directory cannot be null");
            }
            if (quotaBytes <= 0) {
                throw new IllegalArgumentException("Quota must be positive");
            }
            if (namespacePrefix == null || namespacePrefix.isEmpty()) {
                throw new IllegalArgumentException("Namespace prefix cannot be empty");
            }
            if (evictionFraction <= 0 || evictionFraction > 1) {
                throw new IllegalArgumentException("Eviction fraction must be in (0, 1]");
            }
            return new FlatStoreConfig(this);
        }
    }
}
