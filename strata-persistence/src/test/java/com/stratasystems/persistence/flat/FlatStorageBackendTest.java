package com.stratasystems.persistence.flat;

import com.fasterxml.jackson.databind.JsonNode;
import com.stratasystems.persistence.QueryOptions;
import com.stratasystems.persistence.StorageException.QuotaExceededException;
import com.stratasystems.persistence.StoredRecord;
import com.stratasystems.persistence.codec.RecordSerializer;
import com.stratasystems.test.AsyncAssertion;
import com.stratasystems.test.TestRecords;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.stratasystems.test.TestRecords.object;
import static org.junit.jupiter.api.Assertions.*;

class FlatStorageBackendTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Clock FIXED = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private FlatStorageBackend backend;

    @AfterEach
    void tearDown() {
        if (backend != null) {
            backend.close();
        }
    }

    private FlatStorageBackend open(Path dir, long quota) {
        FlatStoreConfig config = FlatStoreConfig.builder(dir).quotaBytes(quota).fsync(false).build();
        FlatStorageBackend opened = new FlatStorageBackend(new FlatFileStore(config), FIXED);
        AsyncAssertion.await(opened.open(), TIMEOUT);
        return opened;
    }

    private static StoredRecord item(String key, int n) {
        return TestRecords.record("items", key, object("n", n, "label", "item-" + n));
    }

    @Test
    void testRoundTripUsesNamespacedWrapper() throws Exception {
        backend = open(tempDir, FlatStoreConfig.DEFAULT_QUOTA_BYTES);
        StoredRecord record = TestRecords.record("users", "alice", object("name", "Alice"));

        AsyncAssertion.await(backend.save("users", "alice", record), TIMEOUT);

        assertEquals(Optional.of(record), AsyncAssertion.await(backend.load("users", "alice"), TIMEOUT));
        JsonNode raw = RecordSerializer.mapper().readTree(backend.store().getItem("strata_users:alice").orElseThrow());
        assertEquals(1_700_000_000_000L, raw.get("timestamp").asLong());
        assertEquals("users:alice", raw.get("data").get("metadata").get("key").asText());
    }

    @Test
    void testCorruptedEntryIsReportedAsMissing() {
        backend = open(tempDir, FlatStoreConfig.DEFAULT_QUOTA_BYTES);
        backend.store().setItem("strata_users:broken", "{not json");
        backend.store().setItem("strata_users:nodata", "{\"timestamp\":1}");

        assertTrue(AsyncAssertion.await(backend.load("users", "broken"), TIMEOUT).isEmpty());
        assertTrue(AsyncAssertion.await(backend.load("users", "nodata"), TIMEOUT).isEmpty());
        assertTrue(AsyncAssertion.await(backend.query("users", r -> true, QueryOptions.DEFAULT), TIMEOUT).isEmpty());
    }

    @Test
    void testQuotaExceededEvictsOldestAndRetries() {
        FlatStorageBackend sizing = open(tempDir.resolve("sizing"), FlatStoreConfig.DEFAULT_QUOTA_BYTES);
        AsyncAssertion.await(sizing.save("items", "k0", item("k0", 0)), TIMEOUT);
        long entrySize = sizing.store().usedBytes();
        sizing.close();

        backend = open(tempDir.resolve("store"), entrySize * 4 + entrySize / 2);
        for (int i = 0; i < 4; i++) {
            AsyncAssertion.await(backend.save("items", "k" + i, item("k" + i, i)), TIMEOUT);
        }

        AsyncAssertion.await(backend.save("items", "k4", item("k4", 4)), TIMEOUT);

        assertFalse(AsyncAssertion.await(backend.load("items", "k0"), TIMEOUT).isPresent());
        for (int i = 1; i <= 4; i++) {
            assertTrue(AsyncAssertion.await(backend.load("items", "k" + i), TIMEOUT).isPresent(), "k" + i);
        }
    }

    @Test
    void testWriteLargerThanQuotaFailsAfterEviction() {
        backend = open(tempDir, 600);
        AsyncAssertion.await(backend.save("items", "a", TestRecords.record("items", "a", object("v", 1))), TIMEOUT);

        StoredRecord huge = TestRecords.record("items", "huge", object("data", "x".repeat(2000)));
        Throwable failure = AsyncAssertion.awaitFailure(backend.save("items", "huge", huge), TIMEOUT);

        assertInstanceOf(QuotaExceededException.class, failure);
    }

    @Test
    void testEvictionSkipsForeignKeysAndPrefersUnreadableEntries() {
        backend = open(tempDir, FlatStoreConfig.DEFAULT_QUOTA_BYTES);
        backend.store().setItem("strata_sync_queue", "[]");
        backend.store().setItem("kc_legacy", "\"old\"");
        AsyncAssertion.await(backend.save("items", "a", item("a", 1)), TIMEOUT);
        AsyncAssertion.await(backend.save("items", "b", item("b", 2)), TIMEOUT);
        backend.store().setItem("strata_items:zz", "garbage");

        int evicted = backend.evictOldest();

        assertEquals(1, evicted);
        assertFalse(backend.store().getItem("strata_items:zz").isPresent());
        assertTrue(backend.store().getItem("strata_sync_queue").isPresent());
        assertTrue(backend.store().getItem("kc_legacy").isPresent());
        assertTrue(backend.store().getItem("strata_items:a").isPresent());
    }

    @Test
    void testClearLeavesForeignKeys() {
        backend = open(tempDir, FlatStoreConfig.DEFAULT_QUOTA_BYTES);
        backend.store().setItem("strata_sync_queue", "[]");
        AsyncAssertion.await(backend.save("a", "1", TestRecords.record("a", "1", object("v", 1))), TIMEOUT);
        AsyncAssertion.await(backend.save("b", "1", TestRecords.record("b", "1", object("v", 2))), TIMEOUT);

        AsyncAssertion.await(backend.clear("a"), TIMEOUT);
        assertTrue(AsyncAssertion.await(backend.load("a", "1"), TIMEOUT).isEmpty());
        assertTrue(AsyncAssertion.await(backend.load("b", "1"), TIMEOUT).isPresent());

        AsyncAssertion.await(backend.clear(null), TIMEOUT);
        assertEquals(List.of("strata_sync_queue"), backend.store().keys());
    }

    @Test
    void testQueryHonoursLimitAndKeyOrder() {
        backend = open(tempDir, FlatStoreConfig.DEFAULT_QUOTA_BYTES);
        for (String key : List.of("c", "a", "b")) {
            AsyncAssertion.await(backend.save("items", key, item(key, 1)), TIMEOUT);
        }

        List<StoredRecord> results = AsyncAssertion.await(
            backend.query("items", r -> true, QueryOptions.limit(2)), TIMEOUT);

        assertEquals(2, results.size());
        assertEquals("items:a", results.get(0).fullKey());
        assertEquals("items:b", results.get(1).fullKey());
    }

    @Test
    void testUnopenedBackendIsUnavailable() {
        FlatStorageBackend unopened = new FlatStorageBackend(
            FlatStoreConfig.builder(tempDir).build());
        try {
            assertFalse(unopened.isAvailable());
        } finally {
            unopened.close();
        }
    }
}
