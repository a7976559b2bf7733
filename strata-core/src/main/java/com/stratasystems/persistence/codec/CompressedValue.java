package com.stratasystems.persistence.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Output of {@link CompressionCodec#compress}: the algorithm name and the encoded payload
 * that goes into a record's {@code value}.
 */
public final class CompressedValue {

    private final String algorithm;
    private final String payload;
    private final long originalSize;

    public CompressedValue(String algorithm, String payload, long originalSize) {
        this.algorithm = algorithm;
        this.payload = payload;
        this.originalSize = originalSize;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public String getPayload() {
        return payload;
    }

    public long getOriginalSize() {
        return originalSize;
    }

    /**
     * @return the payload as the node stored in a record's value
     */
    public JsonNode asNode() {
        return TextNode.valueOf(payload);
    }

    /**
     * @return the stored size of the payload in bytes
     */
    public long getCompressedSize() {
        return RecordSerializer.sizeOf(asNode());
    }
}
