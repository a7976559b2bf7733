package com.stratasystems.service;

import com.stratasystems.persistence.BackendKind;
import com.stratasystems.persistence.StorageBackend;
import com.stratasystems.test.ControllableStorageBackend;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FallbackChainTest {

    private static List<BackendKind> kinds(List<StorageBackend> backends) {
        return backends.stream().map(StorageBackend::kind).collect(Collectors.toList());
    }

    @Test
    void testOrdersByPriorityRegardlessOfRegistrationOrder() {
        FallbackChain chain = new FallbackChain(List.of(
            new ControllableStorageBackend(BackendKind.MEMORY),
            new ControllableStorageBackend(BackendKind.REMOTE),
            new ControllableStorageBackend(BackendKind.FLAT)));

        assertEquals(List.of(BackendKind.REMOTE, BackendKind.FLAT, BackendKind.MEMORY), kinds(chain.all()));
        assertTrue(chain.get(BackendKind.EMBEDDED).isEmpty());
    }

    @Test
    void testNextAvailableSkipsUnavailableTiers() {
        ControllableStorageBackend remote = new ControllableStorageBackend(BackendKind.REMOTE);
        ControllableStorageBackend embedded = new ControllableStorageBackend(BackendKind.EMBEDDED).setAvailable(false);
        ControllableStorageBackend memory = new ControllableStorageBackend(BackendKind.MEMORY);
        FallbackChain chain = new FallbackChain(List.of(remote, embedded, memory));

        assertSame(memory, chain.nextAvailableAfter(BackendKind.REMOTE).orElseThrow());
        assertTrue(chain.nextAvailableAfter(BackendKind.MEMORY).isEmpty());
        assertSame(remote, chain.firstAvailable().orElseThrow());
        assertEquals(List.of(BackendKind.REMOTE, BackendKind.MEMORY), kinds(chain.available()));
        assertEquals(List.of(BackendKind.EMBEDDED, BackendKind.MEMORY), kinds(chain.others(remote)));
    }

    @Test
    void testRejectsDuplicateAndEmptyChains() {
        assertThrows(IllegalArgumentException.class, () -> new FallbackChain(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new FallbackChain(List.of(
            new ControllableStorageBackend(BackendKind.FLAT),
            new ControllableStorageBackend(BackendKind.FLAT))));
    }
}
