package com.stratasystems.persistence.lmdb;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LmdbConfigTest {

    @Test
    void testDefaults() {
        LmdbConfig config = LmdbConfig.builder().dbPath(Path.of("/tmp/x")).build();

        assertEquals(Path.of("/tmp/x"), config.getDbPath());
        assertEquals(3, config.getMaxRetries());
        assertFalse(config.isNoSync());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> LmdbConfig.builder().dbPath(null).build());
        assertThrows(IllegalArgumentException.class, () -> LmdbConfig.builder().mapSize(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> LmdbConfig.builder().mapSize(1024).maxValueSize(4096).build());
        assertThrows(IllegalArgumentException.class, () -> LmdbConfig.builder().maxRetries(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> LmdbConfig.builder().retryDelay(Duration.ofMillis(-1)).build());
    }
}
