package com.stratasystems.service.cache;

import com.stratasystems.persistence.BackendKind;
import com.stratasystems.persistence.StoredRecord;

import java.util.Objects;

/**
 * A cached record together with the time it was cached and the tier that served it.
 *
 * <p>{@code fromBackend} is null for entries restored from the persistent cache snapshot.
 */
public final class CacheEntry {

    private final StoredRecord data;
    private final long timestamp;
    private final BackendKind fromBackend;

    public CacheEntry(StoredRecord data, long timestamp, BackendKind fromBackend) {
        this.data = Objects.requireNonNull(data, "data");
        this.timestamp = timestamp;
        this.fromBackend = fromBackend;
    }

    public StoredRecord getData() {
        return data;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public BackendKind getFromBackend() {
        return fromBackend;
    }

    /**
     * @return the serving tier's id, or {@code "persistent"} for restored entries
     */
    public String source() {
        return fromBackend == null ? "persistent" : fromBackend.id();
    }

    @Override
    public String toString() {
        return "CacheEntry{" + data.fullKey() + ", timestamp=" + timestamp + ", source=" + source() + '}';
    }
}
