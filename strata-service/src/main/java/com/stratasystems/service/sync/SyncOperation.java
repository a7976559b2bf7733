package com.stratasystems.service.sync;

/**
 * Kind of write replayed by the sync queue.
 */
public enum SyncOperation {
    SAVE,
    DELETE
}
