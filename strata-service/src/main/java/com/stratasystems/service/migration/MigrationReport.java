package com.stratasystems.service.migration;

import java.util.List;

/**
 * Counts from one legacy import run.
 */
public final class MigrationReport {

    public static final MigrationReport EMPTY = new MigrationReport(0, List.of(), List.of());

    private final int scanned;
    private final List<String> migratedKeys;
    private final List<String> failedKeys;

    public MigrationReport(int scanned, List<String> migratedKeys, List<String> failedKeys) {
        this.scanned = scanned;
        this.migratedKeys = List.copyOf(migratedKeys);
        this.failedKeys = List.copyOf(failedKeys);
    }

    /**
     * @return legacy raw keys found
     */
    public int getScanned() {
        return scanned;
    }

    public int getMigrated() {
        return migratedKeys.size();
    }

    public int getFailed() {
        return failedKeys.size();
    }

    /**
     * @return target keys written, in scan order
     */
    public List<String> getMigratedKeys() {
        return migratedKeys;
    }

    /**
     * @return legacy raw keys that could not be migrated
     */
    public List<String> getFailedKeys() {
        return failedKeys;
    }

    @Override
    public String toString() {
        return "MigrationReport{scanned=" + scanned + ", migrated=" + getMigrated() + ", failed=" + getFailed() + '}';
    }
}
