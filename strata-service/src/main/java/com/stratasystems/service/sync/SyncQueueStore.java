package com.stratasystems.service.sync;

import java.util.List;

/**
 * Durable home of the sync queue between runs.
 */
public interface SyncQueueStore {

    /**
     * Keeps nothing; the queue lives only as long as the process.
     */
    SyncQueueStore NONE = new SyncQueueStore() {
        @Override
        public List<SyncQueueItem> load() {
            return List.of();
        }

        @Override
        public void save(List<SyncQueueItem> items) {
        }
    };

    /**
     * @return the persisted items in insertion order, empty if nothing was persisted
     */
    List<SyncQueueItem> load();

    /**
     * Replaces the persisted queue.
     *
     * @throws com.stratasystems.persistence.StorageException if the queue cannot be written
     */
    void save(List<SyncQueueItem> items);
}
