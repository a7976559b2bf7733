package com.stratasystems.service.sync;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.stratasystems.persistence.StoredRecord;

import java.util.Objects;

/**
 * One pending write. Immutable; an attempt produces a copy with the counter bumped.
 *
 * <p>{@code record} is present for {@link SyncOperation#SAVE} and absent for deletes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SyncQueueItem {

    private final String id;
    private final SyncOperation operation;
    private final String collection;
    private final String key;
    private final StoredRecord record;
    private final long enqueuedAt;
    private final int attempts;
    private final int maxAttempts;

    @JsonCreator
    public SyncQueueItem(
            @JsonProperty("id") String id,
            @JsonProperty("operation") SyncOperation operation,
            @JsonProperty("collection") String collection,
            @JsonProperty("key") String key,
            @JsonProperty("record") StoredRecord record,
            @JsonProperty("enqueuedAt") long enqueuedAt,
            @JsonProperty("attempts") int attempts,
            @JsonProperty("maxAttempts") int maxAttempts) {
        this.id = Objects.requireNonNull(id, "id");
        this.operation = Objects.requireNonNull(operation, "operation");
        this.collection = Objects.requireNonNull(collection, "collection");
        this.key = Objects.requireNonNull(key, "key");
        if (operation == SyncOperation.SAVE && record == null) {
            throw new IllegalArgumentException("A save item needs a record");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("Max attempts must be positive");
        }
        this.record = record;
        this.enqueuedAt = enqueuedAt;
        this.attempts = attempts;
        this.maxAttempts = maxAttempts;
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("operation")
    public SyncOperation getOperation() {
        return operation;
    }

    @JsonProperty("collection")
    public String getCollection() {
        return collection;
    }

    @JsonProperty("key")
    public String getKey() {
        return key;
    }

    @JsonProperty("record")
    public StoredRecord getRecord() {
        return record;
    }

    @JsonProperty("enqueuedAt")
    public long getEnqueuedAt() {
        return enqueuedAt;
    }

    @JsonProperty("attempts")
    public int getAttempts() {
        return attempts;
    }

    @JsonProperty("maxAttempts")
    public int getMaxAttempts() {
        return maxAttempts;
    }

    public SyncQueueItem withAttempt() {
        return new SyncQueueItem(id, operation, collection, key, record, enqueuedAt, attempts + 1, maxAttempts);
    }

    @JsonIgnore
    public boolean isExhausted() {
        return attempts >= maxAttempts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SyncQueueItem that = (SyncQueueItem) o;
        return enqueuedAt == that.enqueuedAt
            && attempts == that.attempts
            && maxAttempts == that.maxAttempts
            && id.equals(that.id)
            && operation == that.operation
            && collection.equals(that.collection)
            && key.equals(that.key)
            && Objects.equals(record, that.record);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, operation, collection, key, record, enqueuedAt, attempts, maxAttempts);
    }

    @Override
    public String toString() {
        return "SyncQueueItem{" + operation + ' ' + collection + ':' + key +
               ", attempts=" + attempts + '/' + maxAttempts + '}';
    }
}
