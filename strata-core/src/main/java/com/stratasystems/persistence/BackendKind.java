package com.stratasystems.persistence;

/**
 * The closed set of storage tiers a {@link StorageBackend} can represent.
 *
 * <p>Declaration order is fallback priority: the orchestrator always prefers
 * {@link #REMOTE} over {@link #EMBEDDED}, {@link #EMBEDDED} over {@link #FLAT},
 * and uses {@link #MEMORY} only as the last resort.
 */
public enum BackendKind {

    /** Networked key/value cluster (etcd). */
    REMOTE("remote"),

    /** Embedded transactional store (LMDB). */
    EMBEDDED("embedded"),

    /** Quota-limited flat key/value directory. */
    FLAT("flat"),

    /** Process-local map, always available, lost on restart. */
    MEMORY("memory");

    private final String id;

    BackendKind(String id) {
        this.id = id;
    }

    /**
     * @return the short name used in logs, events and diagnostics
     */
    public String id() {
        return id;
    }

    /**
     * @return the fallback priority, lower is preferred
     */
    public int priority() {
        return ordinal();
    }

    /**
     * Resolves a kind from its short name.
     *
     * @param id the short name, case-insensitive
     * @return the matching kind
     * @throws IllegalArgumentException if no kind has that name
     */
    public static BackendKind fromId(String id) {
        for (BackendKind kind : values()) {
            if (kind.id.equalsIgnoreCase(id)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown backend kind: " + id);
    }
}
