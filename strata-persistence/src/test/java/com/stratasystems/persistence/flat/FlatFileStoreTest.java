package com.stratasystems.persistence.flat;

import com.stratasystems.persistence.StorageException.QuotaExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FlatFileStoreTest {

    @TempDir
    Path tempDir;

    private FlatFileStore store;

    @BeforeEach
    void setUp() throws IOException {
        store = new FlatFileStore(FlatStoreConfig.builder(tempDir).quotaBytes(1024).fsync(false).build());
        store.open();
    }

    @Test
    void testSetGetRemove() {
        store.setItem("alpha", "one");

        assertEquals(Optional.of("one"), store.getItem("alpha"));
        assertEquals(8, store.usedBytes());

        assertTrue(store.removeItem("alpha"));
        assertFalse(store.removeItem("alpha"));
        assertEquals(Optional.empty(), store.getItem("alpha"));
        assertEquals(0, store.usedBytes());
    }

    @Test
    void testArbitraryKeysSurviveReopen() throws IOException {
        store.setItem("ns_users:a/b c", "{\"x\":1}");
        store.setItem("kc_ünïcode", "text");
        long used = store.usedBytes();
        store.close();

        FlatFileStore reopened = new FlatFileStore(store.getConfig());
        reopened.open();

        assertEquals(List.of("kc_ünïcode", "ns_users:a/b c"), reopened.keys());
        assertEquals(Optional.of("{\"x\":1}"), reopened.getItem("ns_users:a/b c"));
        assertEquals(used, reopened.usedBytes());
    }

    @Test
    void testKeysWithPrefixAreSorted() {
        store.setItem("p:b", "2");
        store.setItem("p:a", "1");
        store.setItem("q:a", "3");

        assertEquals(List.of("p:a", "p:b"), store.keysWithPrefix("p:"));
    }

    @Test
    void testQuotaIsEnforcedAndOldValueKept() {
        store.setItem("key", "small");

        QuotaExceededException e = assertThrows(QuotaExceededException.class,
            () -> store.setItem("key", "x".repeat(2000)));

        assertEquals(1024, e.getQuotaBytes());
        assertEquals(Optional.of("small"), store.getItem("key"));
    }

    @Test
    void testReplacingValueCountsOnlyOnce() {
        store.setItem("key", "x".repeat(600));
        store.setItem("key", "y".repeat(600));

        assertEquals(603, store.usedBytes());
    }

    @Test
    void testLeftoverTempFilesAreRemovedOnOpen() throws IOException {
        Path stray = tempDir.resolve("abc.entry.tmp");
        Files.writeString(stray, "partial");
        store.close();

        store.open();

        assertFalse(Files.exists(stray));
    }

    @Test
    void testOperationsRequireOpenStore() {
        store.close();
        assertThrows(IllegalStateException.class, () -> store.getItem("a"));
    }
}
