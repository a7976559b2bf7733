package com.stratasystems.service;

/**
 * Options for {@link PersistenceService#load}.
 */
public final class LoadOptions {

    public static final LoadOptions DEFAULT = new LoadOptions(false);
    public static final LoadOptions FORCE_REFRESH = new LoadOptions(true);

    private final boolean forceRefresh;

    private LoadOptions(boolean forceRefresh) {
        this.forceRefresh = forceRefresh;
    }

    /**
     * @return true to bypass the cache and read from the backends
     */
    public boolean isForceRefresh() {
        return forceRefresh;
    }

    @Override
    public String toString() {
        return "LoadOptions{forceRefresh=" + forceRefresh + '}';
    }
}
