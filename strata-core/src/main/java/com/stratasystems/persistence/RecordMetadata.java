package com.stratasystems.persistence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Descriptive half of a {@link StoredRecord} envelope.
 *
 * <p>Sizes are UTF-8 JSON byte counts. {@code compressedSize} and
 * {@code compressionAlgorithm} are only present when {@code compressed} is true.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RecordMetadata {

    /** TTL value meaning the record never expires from the cache on its own account. */
    public static final long INFINITE_TTL = Long.MAX_VALUE;

    private final String key;
    private final String collection;
    private final String originalKey;
    private final long timestamp;
    private final long ttl;
    private final boolean compressed;
    private final String compressionAlgorithm;
    private final long size;
    private final Long compressedSize;

    @JsonCreator
    public RecordMetadata(
            @JsonProperty("key") String key,
            @JsonProperty("collection") String collection,
            @JsonProperty("originalKey") String originalKey,
            @JsonProperty("timestamp") long timestamp,
            @JsonProperty("ttl") long ttl,
            @JsonProperty("compressed") boolean compressed,
            @JsonProperty("compressionAlgorithm") String compressionAlgorithm,
            @JsonProperty("size") long size,
            @JsonProperty("compressedSize") Long compressedSize) {
        this.key = key;
        this.collection = collection;
        this.originalKey = originalKey;
        this.timestamp = timestamp;
        this.ttl = ttl;
        this.compressed = compressed;
        this.compressionAlgorithm = compressionAlgorithm;
        this.size = size;
        this.compressedSize = compressedSize;
    }

    /**
     * Metadata for an uncompressed value.
     */
    public static RecordMetadata plain(String collection, String key, long timestamp, long ttl, long size) {
        return new RecordMetadata(RecordKeys.fullKey(collection, key), collection, key,
            timestamp, ttl, false, null, size, null);
    }

    /**
     * Metadata for a value stored as codec output.
     */
    public static RecordMetadata compressed(String collection, String key, long timestamp, long ttl,
                                            long size, String algorithm, long compressedSize) {
        return new RecordMetadata(RecordKeys.fullKey(collection, key), collection, key,
            timestamp, ttl, true, algorithm, size, compressedSize);
    }

    @JsonProperty("key")
    public String getKey() {
        return key;
    }

    @JsonProperty("collection")
    public String getCollection() {
        return collection;
    }

    @JsonProperty("originalKey")
    public String getOriginalKey() {
        return originalKey;
    }

    @JsonProperty("timestamp")
    public long getTimestamp() {
        return timestamp;
    }

    @JsonProperty("ttl")
    public long getTtl() {
        return ttl;
    }

    @JsonProperty("compressed")
    public boolean isCompressed() {
        return compressed;
    }

    @JsonProperty("compressionAlgorithm")
    public String getCompressionAlgorithm() {
        return compressionAlgorithm;
    }

    @JsonProperty("size")
    public long getSize() {
        return size;
    }

    @JsonProperty("compressedSize")
    public Long getCompressedSize() {
        return compressedSize;
    }

    @JsonIgnore
    public boolean hasInfiniteTtl() {
        return ttl == INFINITE_TTL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecordMetadata that = (RecordMetadata) o;
        return timestamp == that.timestamp
            && ttl == that.ttl
            && compressed == that.compressed
            && size == that.size
            && Objects.equals(key, that.key)
            && Objects.equals(collection, that.collection)
            && Objects.equals(originalKey, that.originalKey)
            && Objects.equals(compressionAlgorithm, that.compressionAlgorithm)
            && Objects.equals(compressedSize, that.compressedSize);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, collection, originalKey, timestamp, ttl, compressed,
            compressionAlgorithm, size, compressedSize);
    }

    @Override
    public String toString() {
        return "RecordMetadata{" +
               "key='" + key + '\'' +
               ", timestamp=" + timestamp +
               ", ttl=" + (hasInfiniteTtl() ? "infinite" : ttl) +
               ", compressed=" + compressed +
               (compressed ? ", algorithm=" + compressionAlgorithm + ", compressedSize=" + compressedSize : "") +
               ", size=" + size +
               '}';
    }
}
