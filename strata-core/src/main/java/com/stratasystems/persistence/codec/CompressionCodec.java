package com.stratasystems.persistence.codec;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Stateless helper deciding whether and how to compress a value before storage.
 */
public interface CompressionCodec {

    /**
     * @return the algorithm name recorded in metadata
     */
    String algorithm();

    /**
     * Decides whether compressing {@code value} is worthwhile.
     *
     * @param value the raw value
     * @param thresholdBytes values smaller than this are never compressed
     * @return true to compress
     */
    boolean shouldCompress(JsonNode value, int thresholdBytes);

    CompressedValue compress(JsonNode value);

    /**
     * Reverses {@link #compress}.
     *
     * @param algorithm the algorithm recorded in the record's metadata
     * @param payload the record's stored value
     * @return the original value
     * @throws com.stratasystems.persistence.StorageException.CorruptedRecordException
     *         if the algorithm is unknown or the payload is damaged
     */
    JsonNode decompress(String algorithm, JsonNode payload);

    CompressionStats stats();
}
