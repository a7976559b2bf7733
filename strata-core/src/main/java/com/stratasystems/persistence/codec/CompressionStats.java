package com.stratasystems.persistence.codec;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running totals for a {@link CompressionCodec}.
 */
public class CompressionStats {

    private final AtomicLong compressions = new AtomicLong(0);
    private final AtomicLong decompressions = new AtomicLong(0);
    private final AtomicLong totalOriginalBytes = new AtomicLong(0);
    private final AtomicLong totalCompressedBytes = new AtomicLong(0);
    private final AtomicLong errors = new AtomicLong(0);

    public void recordCompression(long originalBytes, long compressedBytes) {
        compressions.incrementAndGet();
        totalOriginalBytes.addAndGet(originalBytes);
        totalCompressedBytes.addAndGet(compressedBytes);
    }

    public void recordDecompression() {
        decompressions.incrementAndGet();
    }

    public void recordError() {
        errors.incrementAndGet();
    }

    public long getCompressions() {
        return compressions.get();
    }

    public long getDecompressions() {
        return decompressions.get();
    }

    public long getTotalOriginalBytes() {
        return totalOriginalBytes.get();
    }

    public long getTotalCompressedBytes() {
        return totalCompressedBytes.get();
    }

    public long getErrors() {
        return errors.get();
    }

    /**
     * @return compressed/original over all compressions, 0 before the first one
     */
    public double getCompressionRatio() {
        long original = totalOriginalBytes.get();
        return original > 0 ? (double) totalCompressedBytes.get() / original : 0;
    }

    public long getBytesSaved() {
        return totalOriginalBytes.get() - totalCompressedBytes.get();
    }

    @Override
    public String toString() {
        return "CompressionStats{" +
                "compressions=" + compressions.get() +
                ", decompressions=" + decompressions.get() +
                ", totalOriginalBytes=" + totalOriginalBytes.get() +
                ", totalCompressedBytes=" + totalCompressedBytes.get() +
                ", ratio=" + String.format("%.2f", getCompressionRatio()) +
                ", errors=" + errors.get() +
                '}';
    }
}
