package com.stratasystems.persistence.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.stratasystems.persistence.StorageException.CorruptedRecordException;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class GzipCompressionCodecTest {

    private final GzipCompressionCodec codec = new GzipCompressionCodec();

    private static ObjectNode largeDocument(int entries) {
        ObjectNode root = RecordSerializer.mapper().createObjectNode();
        ArrayNode items = root.putArray("items");
        for (int i = 0; i < entries; i++) {
            items.addObject().put("id", i).put("status", "pending").put("description", "repeated text block");
        }
        return root;
    }

    @Test
    void testSmallValuesAreNotCompressed() {
        assertFalse(codec.shouldCompress(TextNode.valueOf("tiny"), 1024));
    }

    @Test
    void testLargeStructuredValuesAreCompressed() {
        assertTrue(codec.shouldCompress(largeDocument(50), 1024));
    }

    @Test
    void testHighEntropyStringsAreSkipped() {
        Random random = new Random(42);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 4000; i++) {
            sb.append((char) ('!' + random.nextInt(90)));
        }
        assertFalse(codec.shouldCompress(TextNode.valueOf(sb.toString()), 1024));
    }

    @Test
    void testRepetitiveStringsAreCompressed() {
        assertTrue(codec.shouldCompress(TextNode.valueOf("aaaaaaaab".repeat(300)), 1024));
    }

    @Test
    void testCompressionIsTransparent() {
        ObjectNode value = largeDocument(100);

        CompressedValue compressed = codec.compress(value);
        JsonNode restored = codec.decompress(compressed.getAlgorithm(), compressed.asNode());

        assertEquals("gzip", compressed.getAlgorithm());
        assertEquals(value, restored);
        assertTrue(compressed.getCompressedSize() < compressed.getOriginalSize());
        assertEquals(1, codec.stats().getCompressions());
        assertEquals(1, codec.stats().getDecompressions());
        assertTrue(codec.stats().getBytesSaved() > 0);
    }

    @Test
    void testUnknownAlgorithmIsCorruption() {
        assertThrows(CorruptedRecordException.class,
            () -> codec.decompress("lz-string", TextNode.valueOf("abc")));
        assertThrows(CorruptedRecordException.class,
            () -> codec.decompress("gzip", TextNode.valueOf("not base64 gzip!")));
        assertEquals(2, codec.stats().getErrors());
    }

    @Test
    void testNormalisedEntropyBounds() {
        assertEquals(0.0, GzipCompressionCodec.normalisedEntropy("aaaa"));
        assertEquals(1.0, GzipCompressionCodec.normalisedEntropy("abab"), 1e-9);
    }
}
