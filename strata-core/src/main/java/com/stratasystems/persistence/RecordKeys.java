package com.stratasystems.persistence;

/**
 * Builds and validates {@code collection:key} identities.
 */
public final class RecordKeys {

    public static final char SEPARATOR = ':';

    private RecordKeys() {
    }

    public static String fullKey(String collection, String key) {
        requireCollection(collection);
        requireKey(key);
        return collection + SEPARATOR + key;
    }

    public static String requireCollection(String collection) {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("Collection cannot be null or blank");
        }
        if (collection.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("Collection cannot contain '" + SEPARATOR + "': " + collection);
        }
        return collection;
    }

    public static String requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key cannot be null or empty");
        }
        return key;
    }

    /**
     * @return the collection part of a full key, or null if it has no separator
     */
    public static String collectionOf(String fullKey) {
        int idx = fullKey.indexOf(SEPARATOR);
        return idx < 0 ? null : fullKey.substring(0, idx);
    }
}
