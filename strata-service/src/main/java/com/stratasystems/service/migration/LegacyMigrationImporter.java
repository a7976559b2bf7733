package com.stratasystems.service.migration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.stratasystems.persistence.RecordKeys;
import com.stratasystems.persistence.codec.RecordSerializer;
import com.stratasystems.persistence.flat.FlatFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Imports values left in a flat store by the previous storage scheme.
 *
 * <p>Every raw key starting with a legacy prefix (and not with the current namespace prefix)
 * is re-saved as {@code (targetCollection, key without prefix)}. Values are parsed as JSON
 * where possible and kept as text otherwise. Legacy entries are left in place; since target
 * keys are derived from the legacy key, running the import again overwrites the same
 * records instead of duplicating them.
 */
public class LegacyMigrationImporter {
    private static final Logger logger = LoggerFactory.getLogger(LegacyMigrationImporter.class);

    /**
     * Writes one migrated value. Completing with false or exceptionally counts as a failure.
     */
    @FunctionalInterface
    public interface MigrationWriter {
        CompletableFuture<Boolean> write(String collection, String key, JsonNode value);
    }

    private final FlatFileStore store;
    private final List<String> legacyPrefixes;
    private final String excludedPrefix;
    private final String targetCollection;

    public LegacyMigrationImporter(FlatFileStore store, List<String> legacyPrefixes,
                                   String excludedPrefix, String targetCollection) {
        if (legacyPrefixes == null || legacyPrefixes.isEmpty()) {
            throw new IllegalArgumentException("At least one legacy prefix is required");
        }
        this.store = store;
        this.legacyPrefixes = List.copyOf(legacyPrefixes);
        this.excludedPrefix = excludedPrefix;
        this.targetCollection = RecordKeys.requireCollection(targetCollection);
    }

    public CompletableFuture<MigrationReport> migrate(MigrationWriter writer) {
        if (!store.isOpen()) {
            logger.warn("Flat store is not open, skipping legacy migration");
            return CompletableFuture.completedFuture(MigrationReport.EMPTY);
        }
        List<String> candidates = findLegacyKeys();
        if (candidates.isEmpty()) {
            logger.debug("No legacy data found");
            return CompletableFuture.completedFuture(MigrationReport.EMPTY);
        }
        logger.info("Migrating {} legacy entries into {}", candidates.size(), targetCollection);

        List<String> migrated = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        CompletableFuture<Void> run = CompletableFuture.completedFuture(null);
        for (String rawKey : candidates) {
            run = run.thenCompose(v -> migrateOne(rawKey, writer, migrated, failed));
        }
        return run.thenApply(v -> {
            MigrationReport report = new MigrationReport(candidates.size(), migrated, failed);
            logger.info("Legacy migration finished: {}", report);
            return report;
        });
    }

    List<String> findLegacyKeys() {
        List<String> result = new ArrayList<>();
        for (String rawKey : store.keys()) {
            if (excludedPrefix != null && !excludedPrefix.isEmpty() && rawKey.startsWith(excludedPrefix)) {
                continue;
            }
            if (matchingPrefix(rawKey).isPresent()) {
                result.add(rawKey);
            }
        }
        return result;
    }

    private CompletableFuture<Void> migrateOne(String rawKey, MigrationWriter writer,
                                               List<String> migrated, List<String> failed) {
        String prefix = matchingPrefix(rawKey).orElseThrow();
        String targetKey = rawKey.substring(prefix.length());
        if (targetKey.isEmpty()) {
            logger.warn("Legacy key {} has nothing after its prefix, skipping", rawKey);
            failed.add(rawKey);
            return CompletableFuture.completedFuture(null);
        }
        Optional<String> raw = store.getItem(rawKey);
        if (raw.isEmpty()) {
            failed.add(rawKey);
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Boolean> write;
        try {
            write = writer.write(targetCollection, targetKey, parse(raw.get()));
        } catch (RuntimeException e) {
            write = CompletableFuture.failedFuture(e);
        }
        return write.handle((ok, error) -> {
            if (error == null && Boolean.TRUE.equals(ok)) {
                migrated.add(targetKey);
                logger.debug("Migrated {} -> {}:{}", rawKey, targetCollection, targetKey);
            } else {
                failed.add(rawKey);
                logger.warn("Failed to migrate {}", rawKey, error);
            }
            return null;
        });
    }

    private Optional<String> matchingPrefix(String rawKey) {
        return legacyPrefixes.stream().filter(rawKey::startsWith).findFirst();
    }

    static JsonNode parse(String raw) {
        try {
            JsonNode node = RecordSerializer.mapper().readTree(raw);
            return node == null || node.isMissingNode() ? TextNode.valueOf(raw) : node;
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(raw);
        }
    }
}
