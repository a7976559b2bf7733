package com.stratasystems.service.cache;

import com.stratasystems.persistence.BackendKind;
import com.stratasystems.persistence.RecordMetadata;
import com.stratasystems.persistence.StoredRecord;
import com.stratasystems.test.MutableClock;
import com.stratasystems.test.TestRecords;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.stratasystems.test.TestRecords.object;
import static org.junit.jupiter.api.Assertions.*;

class RecordCacheTest {

    private final MutableClock clock = new MutableClock(1_000_000L);
    private final RecordCache cache = new RecordCache(Duration.ofMinutes(5), true, 100, clock);

    private static StoredRecord withTtl(String collection, String key, long ttl) {
        return new StoredRecord(RecordMetadata.plain(collection, key, 1_000_000L, ttl, 10), object("v", 1));
    }

    @Test
    void testEntryExpiresAfterCacheTtl() {
        cache.put("users:alice", TestRecords.record("users", "alice", object("n", 1)), BackendKind.EMBEDDED);

        clock.advance(Duration.ofMinutes(5));
        assertTrue(cache.get("users:alice").isPresent());

        clock.advance(Duration.ofMillis(1));
        assertTrue(cache.get("users:alice").isEmpty());
        assertEquals(0, cache.size(), "expired entry is removed on read");
    }

    @Test
    void testRecordTtlShorterThanCacheTtlWins() {
        cache.put("users:short", withTtl("users", "short", 1_000), BackendKind.FLAT);
        cache.put("users:zero", withTtl("users", "zero", 0), BackendKind.FLAT);

        assertTrue(cache.get("users:zero").isEmpty());
        assertTrue(cache.get("users:short").isPresent());
        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get("users:short").isEmpty());
    }

    @Test
    void testInvalidateCollectionDropsRecordsAndQueries() {
        cache.put("users:a", TestRecords.record("users", "a", object()), BackendKind.MEMORY);
        cache.put("users:b", TestRecords.record("users", "b", object()), BackendKind.MEMORY);
        cache.put("usersarchive:c", TestRecords.record("usersarchive", "c", object()), BackendKind.MEMORY);
        cache.put("query:users:abc", TestRecords.record("query", "users:abc", object()), BackendKind.MEMORY);
        cache.put("query:orders:def", TestRecords.record("query", "orders:def", object()), BackendKind.MEMORY);

        cache.invalidateCollection("users");

        assertEquals(List.of("query:orders:def", "usersarchive:c"), cache.keys());
    }

    @Test
    void testInvalidateQueriesKeepsRecords() {
        cache.put("users:a", TestRecords.record("users", "a", object()), BackendKind.MEMORY);
        cache.put("query:users:abc", TestRecords.record("query", "users:abc", object()), BackendKind.MEMORY);

        cache.invalidateQueries("users");

        assertEquals(List.of("users:a"), cache.keys());
    }

    @Test
    void testDisabledCacheStoresNothing() {
        RecordCache disabled = new RecordCache(Duration.ofMinutes(5), false, 100, clock);
        disabled.put("users:a", TestRecords.record("users", "a", object()), BackendKind.MEMORY);

        assertEquals(0, disabled.size());
        assertTrue(disabled.get("users:a").isEmpty());
    }

    @Test
    void testSweepRemovesOnlyExpired() {
        cache.put("users:old", TestRecords.record("users", "old", object()), BackendKind.MEMORY);
        clock.advance(Duration.ofMinutes(4));
        cache.put("users:new", TestRecords.record("users", "new", object()), BackendKind.MEMORY);
        clock.advance(Duration.ofMinutes(2));

        assertEquals(1, cache.sweep());
        assertEquals(List.of("users:new"), cache.keys());
    }

    @Test
    void testOldestEntriesEvictedWhenFull() {
        RecordCache small = new RecordCache(Duration.ofMinutes(5), true, 2, clock);
        small.put("c:1", TestRecords.record("c", "1", object()), BackendKind.MEMORY);
        clock.advance(Duration.ofMillis(1));
        small.put("c:2", TestRecords.record("c", "2", object()), BackendKind.MEMORY);
        clock.advance(Duration.ofMillis(1));
        small.put("c:3", TestRecords.record("c", "3", object()), BackendKind.MEMORY);

        assertEquals(List.of("c:2", "c:3"), small.keys());
    }

    @Test
    void testSnapshotFiltersKeysAndSkipsExpired() {
        cache.put("system:a", TestRecords.record("system", "a", object()), BackendKind.MEMORY);
        cache.put("config:b", withTtl("config", "b", 0), BackendKind.MEMORY);
        cache.put("users:c", TestRecords.record("users", "c", object()), BackendKind.MEMORY);

        assertEquals(List.of("system:a"),
            List.copyOf(cache.snapshot(k -> k.startsWith("system:") || k.startsWith("config:")).keySet()));
    }

    @Test
    void testRestoredEntryReportsPersistentSource() {
        cache.put("system:a", TestRecords.record("system", "a", object()), null);
        assertEquals("persistent", cache.get("system:a").orElseThrow().source());
    }
}
