package com.stratasystems.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stratasystems.persistence.QueryFilter;
import com.stratasystems.persistence.QueryOptions;
import com.stratasystems.persistence.RecordKeys;
import com.stratasystems.persistence.StorageException;
import com.stratasystems.persistence.codec.RecordSerializer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives the cache key of a query result set.
 *
 * <p>Key format: {@code query:<collection>:<sha256>} where the digest covers a sorted JSON
 * rendering of the collection, the filter and the limit. Equal queries always map to the
 * same key, and all result sets of one collection share a prefix.
 */
public final class QueryCacheKeys {

    private QueryCacheKeys() {
    }

    public static String of(String collection, QueryFilter filter, QueryOptions options) {
        ObjectNode descriptor = RecordSerializer.mapper().createObjectNode();
        descriptor.put("collection", collection);
        descriptor.set("filter", filter.toJson());
        descriptor.putObject("options").put("limit", options.getLimit());
        try {
            String stable = RecordSerializer.mapper().writeValueAsString(descriptor);
            return RecordCache.QUERY_PREFIX + collection + RecordKeys.SEPARATOR + sha256(stable);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to derive query cache key for " + collection, e);
        }
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
