package com.stratasystems.persistence.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.stratasystems.persistence.StorageException;
import com.stratasystems.persistence.StorageException.CorruptedRecordException;
import com.stratasystems.persistence.StoredRecord;

import java.io.IOException;

/**
 * JSON wire format shared by every storage tier.
 *
 * <p>One {@link ObjectMapper} is shared process-wide. Map entries and bean properties
 * are written in sorted order so equal inputs always produce equal bytes.
 */
public final class RecordSerializer {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
        .build();

    private RecordSerializer() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static byte[] toBytes(StoredRecord record) {
        try {
            return MAPPER.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize record " + record.fullKey(), e);
        }
    }

    /**
     * Parses a stored record.
     *
     * @param bytes the stored bytes
     * @param recordKey the key the bytes were read from, used in error messages
     * @return the record
     * @throws CorruptedRecordException if the bytes are not a valid record envelope
     */
    public static StoredRecord fromBytes(byte[] bytes, String recordKey) {
        try {
            StoredRecord record = MAPPER.readValue(bytes, StoredRecord.class);
            if (record.getMetadata().getKey() == null) {
                throw new CorruptedRecordException("Record metadata has no key", recordKey);
            }
            return record;
        } catch (IOException | IllegalArgumentException e) {
            throw new CorruptedRecordException("Failed to parse stored record", recordKey, e);
        }
    }

    public static StoredRecord fromTree(JsonNode node, String recordKey) {
        try {
            return MAPPER.treeToValue(node, StoredRecord.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CorruptedRecordException("Failed to parse stored record", recordKey, e);
        }
    }

    public static JsonNode toTree(StoredRecord record) {
        return MAPPER.valueToTree(record);
    }

    public static byte[] writeValue(JsonNode value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize value", e);
        }
    }

    /**
     * @return the UTF-8 JSON byte count of {@code value}, 0 for null
     */
    public static long sizeOf(JsonNode value) {
        return value == null || value.isNull() ? 0 : writeValue(value).length;
    }
}
