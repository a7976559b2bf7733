package com.stratasystems.service.cache;

import com.stratasystems.persistence.BackendKind;
import com.stratasystems.test.AsyncAssertion;
import com.stratasystems.test.MutableClock;
import com.stratasystems.test.TestRecords;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.stratasystems.test.TestRecords.object;
import static org.junit.jupiter.api.Assertions.*;

class CacheSweeperTest {

    @Test
    void testScheduledSweepRemovesExpiredEntries() {
        MutableClock clock = new MutableClock(0);
        RecordCache cache = new RecordCache(Duration.ofSeconds(1), true, 10, clock);
        cache.put("users:a", TestRecords.record("users", "a", object()), BackendKind.MEMORY);
        clock.advance(Duration.ofSeconds(2));

        try (CacheSweeper sweeper = new CacheSweeper(cache, Duration.ofMillis(20))) {
            sweeper.start();
            AsyncAssertion.eventually(() -> sweeper.getTotalRemoved() == 1, Duration.ofSeconds(2));
            assertEquals(0, cache.size());
            assertTrue(sweeper.getTotalSweeps() >= 1);
        }
    }

    @Test
    void testSweepNowCountsRemovals() {
        MutableClock clock = new MutableClock(0);
        RecordCache cache = new RecordCache(Duration.ofSeconds(1), true, 10, clock);
        cache.put("users:a", TestRecords.record("users", "a", object()), BackendKind.MEMORY);
        CacheSweeper sweeper = new CacheSweeper(cache, Duration.ofMinutes(5));

        assertEquals(0, sweeper.sweepNow());
        clock.advance(Duration.ofSeconds(2));
        assertEquals(1, sweeper.sweepNow());
        assertEquals(2, sweeper.getTotalSweeps());
        sweeper.stop();
    }

    @Test
    void testRejectsNonPositiveInterval() {
        RecordCache cache = new RecordCache(Duration.ofSeconds(1), true, 10, new MutableClock(0));
        assertThrows(IllegalArgumentException.class, () -> new CacheSweeper(cache, Duration.ZERO));
    }
}
