package com.stratasystems.service.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.stratasystems.persistence.StorageException;
import com.stratasystems.persistence.codec.RecordSerializer;
import com.stratasystems.persistence.flat.FlatFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Keeps the sync queue as one JSON array under the raw key {@code <namespacePrefix>sync_queue}
 * of a flat store, alongside the flat tier's own records.
 */
public class FlatSyncQueueStore implements SyncQueueStore {
    private static final Logger logger = LoggerFactory.getLogger(FlatSyncQueueStore.class);

    public static final String QUEUE_KEY_SUFFIX = "sync_queue";

    private static final TypeReference<List<SyncQueueItem>> ITEMS = new TypeReference<>() {
    };

    private final FlatFileStore store;
    private final String rawKey;

    public FlatSyncQueueStore(FlatFileStore store, String namespacePrefix) {
        this.store = store;
        this.rawKey = namespacePrefix + QUEUE_KEY_SUFFIX;
    }

    @Override
    public List<SyncQueueItem> load() {
        if (!store.isOpen()) {
            logger.warn("Flat store is not open, sync queue starts empty");
            return List.of();
        }
        Optional<String> raw = store.getItem(rawKey);
        if (raw.isEmpty()) {
            return List.of();
        }
        try {
            return RecordSerializer.mapper().readValue(raw.get(), ITEMS);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.warn("Discarding unreadable sync queue at {}", rawKey, e);
            return List.of();
        }
    }

    @Override
    public void save(List<SyncQueueItem> items) {
        if (!store.isOpen()) {
            throw new StorageException("Flat store is not open, cannot persist sync queue");
        }
        if (items.isEmpty()) {
            store.removeItem(rawKey);
            return;
        }
        try {
            store.setItem(rawKey, RecordSerializer.mapper().writeValueAsString(items));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize sync queue", e);
        }
    }

    public String rawKey() {
        return rawKey;
    }
}
