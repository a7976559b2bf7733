package com.stratasystems.service;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.stratasystems.persistence.StorageException;
import com.stratasystems.persistence.codec.RecordSerializer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Portable dump of decoded collection contents.
 *
 * <p>JSON shape: {@code {"version", "timestamp", "backend", "collections": {name: {"count", "items"}}}}.
 */
@JsonPropertyOrder({"version", "timestamp", "backend", "collections"})
public final class ExportSnapshot {

    public static final String FORMAT_VERSION = "2.0.0";

    private final String version;
    private final String timestamp;
    private final String backend;
    private final Map<String, CollectionExport> collections;

    public ExportSnapshot(String timestamp, String backend, Map<String, CollectionExport> collections) {
        this.version = FORMAT_VERSION;
        this.timestamp = timestamp;
        this.backend = backend;
        this.collections = Collections.unmodifiableMap(new LinkedHashMap<>(collections));
    }

    public String getVersion() {
        return version;
    }

    /**
     * @return ISO-8601 instant the export was taken
     */
    public String getTimestamp() {
        return timestamp;
    }

    public String getBackend() {
        return backend;
    }

    public Map<String, CollectionExport> getCollections() {
        return collections;
    }

    public JsonNode toJson() {
        return RecordSerializer.mapper().valueToTree(this);
    }

    public String toJsonString() {
        try {
            return RecordSerializer.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to render export", e);
        }
    }

    @JsonPropertyOrder({"count", "items"})
    public static final class CollectionExport {
        private final List<JsonNode> items;

        public CollectionExport(List<JsonNode> items) {
            this.items = List.copyOf(items);
        }

        public int getCount() {
            return items.size();
        }

        public List<JsonNode> getItems() {
            return items;
        }
    }
}
