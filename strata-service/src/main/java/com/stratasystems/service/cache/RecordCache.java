package com.stratasystems.service.cache;

import com.stratasystems.persistence.BackendKind;
import com.stratasystems.persistence.RecordKeys;
import com.stratasystems.persistence.StoredRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Process-local, non-authoritative copy of recently used records keyed by full key.
 *
 * <p>An entry is expired once it is older than the cache TTL, or once its age reaches the
 * record's own TTL. Expired entries are never returned; {@link #get} removes them on the
 * way out and {@link #sweep} removes them proactively. The cache holds at most
 * {@code maxEntries} entries, dropping the oldest when full.
 */
public class RecordCache {
    private static final Logger logger = LoggerFactory.getLogger(RecordCache.class);

    /** Prefix of keys holding cached query results. */
    public static final String QUERY_PREFIX = "query" + RecordKeys.SEPARATOR;

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final long ttlMillis;
    private final boolean enabled;
    private final int maxEntries;
    private final Clock clock;

    public RecordCache(Duration ttl, boolean enabled, int maxEntries, Clock clock) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be non-negative");
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Max entries must be positive");
        }
        this.ttlMillis = ttl.toMillis();
        this.enabled = enabled;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public Optional<CacheEntry> get(String fullKey) {
        if (!enabled) {
            return Optional.empty();
        }
        CacheEntry entry = entries.get(fullKey);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry)) {
            entries.remove(fullKey, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public void put(String fullKey, StoredRecord record, BackendKind fromBackend) {
        if (!enabled) {
            return;
        }
        entries.put(fullKey, new CacheEntry(record, clock.millis(), fromBackend));
        if (entries.size() > maxEntries) {
            evictOldest(entries.size() - maxEntries);
        }
    }

    public void invalidate(String fullKey) {
        entries.remove(fullKey);
    }

    /**
     * Drops every record of {@code collection} along with its cached query results.
     */
    public void invalidateCollection(String collection) {
        String recordPrefix = collection + RecordKeys.SEPARATOR;
        entries.keySet().removeIf(key -> key.startsWith(recordPrefix));
        invalidateQueries(collection);
    }

    public void invalidateQueries(String collection) {
        String queryPrefix = QUERY_PREFIX + collection + RecordKeys.SEPARATOR;
        entries.keySet().removeIf(key -> key.startsWith(queryPrefix));
    }

    public boolean isExpired(CacheEntry entry) {
        long age = clock.millis() - entry.getTimestamp();
        if (age > ttlMillis) {
            return true;
        }
        return !entry.getData().getMetadata().hasInfiniteTtl()
            && age >= entry.getData().getMetadata().getTtl();
    }

    /**
     * Removes every expired entry.
     *
     * @return the number of entries removed
     */
    public int sweep() {
        int removed = 0;
        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            if (isExpired(e.getValue()) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.debug("Cache sweep removed {} expired entries", removed);
        }
        return removed;
    }

    /**
     * @return the live entries whose key matches {@code keyFilter}, in key order
     */
    public Map<String, CacheEntry> snapshot(Predicate<String> keyFilter) {
        Map<String, CacheEntry> result = new LinkedHashMap<>();
        entries.entrySet().stream()
            .filter(e -> keyFilter.test(e.getKey()) && !isExpired(e.getValue()))
            .sorted(Map.Entry.comparingByKey())
            .forEach(e -> result.put(e.getKey(), e.getValue()));
        return result;
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return all keys in sorted order
     */
    public List<String> keys() {
        List<String> keys = new ArrayList<>(entries.keySet());
        keys.sort(Comparator.naturalOrder());
        return keys;
    }

    public void clear() {
        entries.clear();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Duration getTtl() {
        return Duration.ofMillis(ttlMillis);
    }

    private void evictOldest(int count) {
        entries.entrySet().stream()
            .sorted(Comparator.comparingLong(e -> e.getValue().getTimestamp()))
            .limit(count)
            .map(Map.Entry::getKey)
            .forEach(entries::remove);
    }
}
