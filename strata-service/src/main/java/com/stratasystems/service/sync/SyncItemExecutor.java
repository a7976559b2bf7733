package com.stratasystems.service.sync;

import java.util.concurrent.CompletableFuture;

/**
 * Replays one queue item against whichever backend is active at that moment.
 */
@FunctionalInterface
public interface SyncItemExecutor {
    CompletableFuture<Void> execute(SyncQueueItem item);
}
