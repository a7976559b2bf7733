package com.stratasystems.service;

import com.stratasystems.persistence.BackendKind;
import com.stratasystems.persistence.StorageBackend;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The configured backends in priority order, at most one per {@link BackendKind}.
 */
public final class FallbackChain {

    private final List<StorageBackend> backends;
    private final Map<BackendKind, StorageBackend> byKind = new EnumMap<>(BackendKind.class);

    public FallbackChain(List<? extends StorageBackend> backends) {
        if (backends == null || backends.isEmpty()) {
            throw new IllegalArgumentException("At least one backend is required");
        }
        List<StorageBackend> ordered = new ArrayList<>(backends);
        ordered.sort(Comparator.comparingInt(StorageBackend::priority));
        for (StorageBackend backend : ordered) {
            if (byKind.putIfAbsent(backend.kind(), backend) != null) {
                throw new IllegalArgumentException("Duplicate backend for " + backend.kind());
            }
        }
        this.backends = List.copyOf(ordered);
    }

    public List<StorageBackend> all() {
        return backends;
    }

    public Optional<StorageBackend> get(BackendKind kind) {
        return Optional.ofNullable(byKind.get(kind));
    }

    public Optional<StorageBackend> firstAvailable() {
        return backends.stream().filter(StorageBackend::isAvailable).findFirst();
    }

    /**
     * @return the first available backend ranked below {@code kind}
     */
    public Optional<StorageBackend> nextAvailableAfter(BackendKind kind) {
        return backends.stream()
            .filter(b -> b.priority() > kind.priority())
            .filter(StorageBackend::isAvailable)
            .findFirst();
    }

    /**
     * @return every backend except {@code excluded}, in priority order
     */
    public List<StorageBackend> others(StorageBackend excluded) {
        return backends.stream().filter(b -> b != excluded).collect(Collectors.toList());
    }

    public List<StorageBackend> available() {
        return backends.stream().filter(StorageBackend::isAvailable).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return backends.stream().map(StorageBackend::name).collect(Collectors.joining(" > ", "FallbackChain[", "]"));
    }
}
