package com.stratasystems.persistence.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.stratasystems.persistence.StorageException;
import com.stratasystems.persistence.StorageException.CorruptedRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * GZIP over the value's JSON bytes, Base64 encoded so the payload fits the JSON envelope.
 *
 * <p>String values that already look random (normalised character entropy above
 * {@value #ENTROPY_CEILING}) are left alone since they rarely shrink.
 */
public class GzipCompressionCodec implements CompressionCodec {
    private static final Logger logger = LoggerFactory.getLogger(GzipCompressionCodec.class);

    public static final String ALGORITHM = "gzip";
    static final double ENTROPY_CEILING = 0.9;

    private final CompressionStats stats = new CompressionStats();

    @Override
    public String algorithm() {
        return ALGORITHM;
    }

    @Override
    public boolean shouldCompress(JsonNode value, int thresholdBytes) {
        long size = RecordSerializer.sizeOf(value);
        if (size < thresholdBytes) {
            return false;
        }
        if (value.isTextual() && normalisedEntropy(value.textValue()) > ENTROPY_CEILING) {
            logger.debug("Skipping compression of high-entropy string ({} bytes)", size);
            return false;
        }
        return true;
    }

    @Override
    public CompressedValue compress(JsonNode value) {
        byte[] raw = RecordSerializer.writeValue(value);
        ByteArrayOutputStream bos = new ByteArrayOutputStream(Math.max(32, raw.length / 4));
        try (GZIPOutputStream gzip = new GZIPOutputStream(bos)) {
            gzip.write(raw);
        } catch (IOException e) {
            stats.recordError();
            throw new StorageException("Failed to compress value", e);
        }
        CompressedValue compressed = new CompressedValue(ALGORITHM,
            Base64.getEncoder().encodeToString(bos.toByteArray()), raw.length);
        stats.recordCompression(raw.length, compressed.getCompressedSize());
        logger.debug("Compressed {} bytes to {} bytes", raw.length, compressed.getCompressedSize());
        return compressed;
    }

    @Override
    public JsonNode decompress(String algorithm, JsonNode payload) {
        if (!ALGORITHM.equals(algorithm)) {
            stats.recordError();
            throw new CorruptedRecordException("Unknown compression algorithm " + algorithm, "?");
        }
        if (payload == null || !payload.isTextual()) {
            stats.recordError();
            throw new CorruptedRecordException("Compressed payload is not text", "?");
        }
        try (GZIPInputStream gzip = new GZIPInputStream(
                new ByteArrayInputStream(Base64.getDecoder().decode(payload.textValue())))) {
            JsonNode value = RecordSerializer.mapper().readTree(gzip.readAllBytes());
            stats.recordDecompression();
            return value;
        } catch (IOException | IllegalArgumentException e) {
            stats.recordError();
            throw new CorruptedRecordException("Failed to decompress payload", "?", e);
        }
    }

    @Override
    public CompressionStats stats() {
        return stats;
    }

    /**
     * Shannon entropy of the character distribution, divided by its maximum for the
     * number of distinct characters. Returns 0 for strings with fewer than two distinct
     * characters.
     */
    static double normalisedEntropy(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        Map<Integer, Integer> frequencies = new HashMap<>();
        text.codePoints().forEach(cp -> frequencies.merge(cp, 1, Integer::sum));
        if (frequencies.size() < 2) {
            return 0;
        }
        long length = text.codePointCount(0, text.length());
        double entropy = 0;
        for (int count : frequencies.values()) {
            double p = (double) count / length;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        double max = Math.log(frequencies.size()) / Math.log(2);
        return entropy / max;
    }
}
