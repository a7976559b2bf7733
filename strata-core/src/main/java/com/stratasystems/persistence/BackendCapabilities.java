package com.stratasystems.persistence;

/**
 * Optional operations a backend supports beyond save/load/delete.
 */
public final class BackendCapabilities {

    public static final BackendCapabilities ALL = new BackendCapabilities(true, true);

    private final boolean query;
    private final boolean clear;

    public BackendCapabilities(boolean query, boolean clear) {
        this.query = query;
        this.clear = clear;
    }

    public boolean supportsQuery() {
        return query;
    }

    public boolean supportsClear() {
        return clear;
    }

    @Override
    public String toString() {
        return "BackendCapabilities{query=" + query + ", clear=" + clear + '}';
    }
}
