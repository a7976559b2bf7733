package com.stratasystems.service;

import com.stratasystems.persistence.RecordMetadata;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for {@link PersistenceService#save}.
 */
public final class SaveOptions {

    public static final SaveOptions DEFAULT = new SaveOptions(null, CompressionMode.AUTO);

    private final Long ttlMillis;
    private final CompressionMode compression;

    private SaveOptions(Long ttlMillis, CompressionMode compression) {
        if (ttlMillis != null && ttlMillis < 0) {
            throw new IllegalArgumentException("TTL cannot be negative");
        }
        this.ttlMillis = ttlMillis;
        this.compression = Objects.requireNonNull(compression, "compression");
    }

    public static SaveOptions ttl(Duration ttl) {
        return DEFAULT.withTtl(ttl);
    }

    public static SaveOptions infiniteTtl() {
        return new SaveOptions(RecordMetadata.INFINITE_TTL, CompressionMode.AUTO);
    }

    public static SaveOptions compression(CompressionMode mode) {
        return new SaveOptions(null, mode);
    }

    public SaveOptions withTtl(Duration ttl) {
        return new SaveOptions(ttl.toMillis(), compression);
    }

    public SaveOptions withCompression(CompressionMode mode) {
        return new SaveOptions(ttlMillis, mode);
    }

    /**
     * @return the TTL in milliseconds, or null to use the configured default
     */
    public Long getTtlMillis() {
        return ttlMillis;
    }

    public CompressionMode getCompression() {
        return compression;
    }

    @Override
    public String toString() {
        return "SaveOptions{ttl=" + ttlMillis + ", compression=" + compression + '}';
    }
}
