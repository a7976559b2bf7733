package com.stratasystems.test;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stratasystems.persistence.RecordMetadata;
import com.stratasystems.persistence.StoredRecord;
import com.stratasystems.persistence.codec.RecordSerializer;

/**
 * Builders for records and JSON values used across module tests.
 */
public final class TestRecords {

    private TestRecords() {
    }

    public static StoredRecord record(String collection, String key, JsonNode value) {
        return record(collection, key, value, 1_000L);
    }

    public static StoredRecord record(String collection, String key, JsonNode value, long timestamp) {
        return new StoredRecord(RecordMetadata.plain(collection, key, timestamp,
            RecordMetadata.INFINITE_TTL, RecordSerializer.sizeOf(value)), value);
    }

    public static JsonNode json(String text) {
        try {
            return RecordSerializer.mapper().readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON in test: " + text, e);
        }
    }

    /**
     * Builds an object node from alternating field names and values.
     */
    public static ObjectNode object(Object... fieldsAndValues) {
        if (fieldsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected field/value pairs");
        }
        ObjectNode node = RecordSerializer.mapper().createObjectNode();
        for (int i = 0; i < fieldsAndValues.length; i += 2) {
            node.set((String) fieldsAndValues[i], RecordSerializer.mapper().valueToTree(fieldsAndValues[i + 1]));
        }
        return node;
    }
}
