package com.stratasystems.persistence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * The envelope every storage tier persists: metadata plus a value.
 *
 * <p>When {@code metadata.compressed} is true the value is the codec's output (a text
 * node holding the encoded payload), never the raw value. Instances are immutable; an
 * update is a new record with a new timestamp.
 */
public final class StoredRecord {

    private final RecordMetadata metadata;
    private final JsonNode value;

    @JsonCreator
    public StoredRecord(
            @JsonProperty("metadata") RecordMetadata metadata,
            @JsonProperty("value") JsonNode value) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.value = value;
    }

    @JsonProperty("metadata")
    public RecordMetadata getMetadata() {
        return metadata;
    }

    @JsonProperty("value")
    public JsonNode getValue() {
        return value;
    }

    @JsonIgnore
    public String fullKey() {
        return metadata.getKey();
    }

    @JsonIgnore
    public boolean isCompressed() {
        return metadata.isCompressed();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StoredRecord that = (StoredRecord) o;
        return metadata.equals(that.metadata) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metadata, value);
    }

    @Override
    public String toString() {
        return "StoredRecord{" + metadata + '}';
    }
}
