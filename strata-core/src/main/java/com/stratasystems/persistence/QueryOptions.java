package com.stratasystems.persistence;

import java.util.Objects;

/**
 * Options for a collection query.
 */
public final class QueryOptions {

    /** Unbounded, cache allowed. */
    public static final QueryOptions DEFAULT = new QueryOptions(0, false);

    private final int limit;
    private final boolean forceRefresh;

    private QueryOptions(int limit, boolean forceRefresh) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative");
        }
        this.limit = limit;
        this.forceRefresh = forceRefresh;
    }

    public static QueryOptions limit(int limit) {
        return new QueryOptions(limit, false);
    }

    public QueryOptions withForceRefresh(boolean forceRefresh) {
        return new QueryOptions(limit, forceRefresh);
    }

    /**
     * @return the maximum number of results, 0 for no limit
     */
    public int getLimit() {
        return limit;
    }

    public boolean hasLimit() {
        return limit > 0;
    }

    public boolean isForceRefresh() {
        return forceRefresh;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueryOptions that = (QueryOptions) o;
        return limit == that.limit && forceRefresh == that.forceRefresh;
    }

    @Override
    public int hashCode() {
        return Objects.hash(limit, forceRefresh);
    }

    @Override
    public String toString() {
        return "QueryOptions{limit=" + limit + ", forceRefresh=" + forceRefresh + '}';
    }
}
