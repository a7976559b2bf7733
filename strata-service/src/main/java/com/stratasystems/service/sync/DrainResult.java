package com.stratasystems.service.sync;

import java.util.List;

/**
 * Outcome of one drain pass.
 */
public final class DrainResult {

    private final int processed;
    private final List<SyncQueueItem> dropped;
    private final int remaining;
    private final boolean skipped;

    DrainResult(int processed, List<SyncQueueItem> dropped, int remaining, boolean skipped) {
        this.processed = processed;
        this.dropped = List.copyOf(dropped);
        this.remaining = remaining;
        this.skipped = skipped;
    }

    static DrainResult skipped(int remaining) {
        return new DrainResult(0, List.of(), remaining, true);
    }

    public int getProcessed() {
        return processed;
    }

    /**
     * @return items removed after exhausting their attempts
     */
    public List<SyncQueueItem> getDropped() {
        return dropped;
    }

    public int getRemaining() {
        return remaining;
    }

    /**
     * @return true if no pass ran (offline, or another drain was in flight)
     */
    public boolean isSkipped() {
        return skipped;
    }

    public boolean hasActivity() {
        return processed > 0 || !dropped.isEmpty();
    }

    @Override
    public String toString() {
        return "DrainResult{processed=" + processed + ", dropped=" + dropped.size() +
               ", remaining=" + remaining + (skipped ? ", skipped" : "") + '}';
    }
}
