package com.stratasystems.persistence.flat;

import com.stratasystems.persistence.StorageException;
import com.stratasystems.persistence.StorageException.QuotaExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Synchronous string key/value store with a byte quota, one file per key.
 *
 * <p>File names are the URL-safe Base64 of the key, so any key round-trips through the
 * directory listing. Writes go to a temp file that is moved over the target atomically;
 * a crash leaves either the old or the new value. Usage is the sum of UTF-8 key and
 * value lengths, tracked in memory and rebuilt from the directory by {@link #open()}.
 *
 * <p>All methods are synchronized on the store.
 */
public class FlatFileStore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FlatFileStore.class);

    private static final String ENTRY_SUFFIX = ".entry";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final int MAX_FILE_NAME_LENGTH = 240;

    private final FlatStoreConfig config;
    private final TreeMap<String, Long> index = new TreeMap<>();
    private long usedBytes = 0;
    private boolean open = false;

    public FlatFileStore(FlatStoreConfig config) {
        this.config = config;
    }

    /**
     * Creates the directory if needed and indexes existing entries. Idempotent.
     */
    public synchronized void open() throws IOException {
        if (open) {
            return;
        }
        Path dir = config.getDirectory();
        Files.createDirectories(dir);

        index.clear();
        usedBytes = 0;
        try (Stream<Path> paths = Files.list(dir)) {
            for (Path path : paths.collect(Collectors.toList())) {
                String fileName = path.getFileName().toString();
                if (fileName.endsWith(TEMP_SUFFIX)) {
                    logger.debug("Removing leftover temp file {}", path);
                    Files.deleteIfExists(path);
                    continue;
                }
                if (!fileName.endsWith(ENTRY_SUFFIX)) {
                    continue;
                }
                String key;
                try {
                    key = decodeFileName(fileName);
                } catch (IllegalArgumentException e) {
                    logger.warn("Ignoring unrecognised file in flat store: {}", path);
                    continue;
                }
                long size = key.getBytes(UTF_8).length + Files.size(path);
                index.put(key, size);
                usedBytes += size;
            }
        }
        open = true;
        logger.info("Flat store opened at {} ({} entries, {} of {} bytes used)",
            dir, index.size(), usedBytes, config.getQuotaBytes());
    }

    public synchronized boolean isOpen() {
        return open;
    }

    public synchronized Optional<String> getItem(String key) {
        ensureOpen();
        if (!index.containsKey(key)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(pathFor(key), UTF_8));
        } catch (NoSuchFileException e) {
            logger.debug("Entry {} disappeared from disk", key);
            forget(key);
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to read flat entry " + key, e);
        }
    }

    /**
     * Writes or replaces an entry.
     *
     * @throws QuotaExceededException if the write would take usage past the quota
     */
    public synchronized void setItem(String key, String value) {
        ensureOpen();
        byte[] data = value.getBytes(UTF_8);
        long entrySize = key.getBytes(UTF_8).length + data.length;
        long previous = index.getOrDefault(key, 0L);
        long projected = usedBytes - previous + entrySize;
        if (projected > config.getQuotaBytes()) {
            throw new QuotaExceededException(projected, config.getQuotaBytes());
        }

        Path target = pathFor(key);
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try {
            try (FileOutputStream fos = new FileOutputStream(temp.toFile())) {
                fos.write(data);
                if (config.isFsync()) {
                    fos.getFD().sync();
                }
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanupEx) {
                logger.warn("Failed to clean up temp file {}", temp, cleanupEx);
            }
            throw new StorageException("Failed to write flat entry " + key, e);
        }
        index.put(key, entrySize);
        usedBytes = projected;
    }

    /**
     * @return true if an entry was removed
     */
    public synchronized boolean removeItem(String key) {
        ensureOpen();
        if (!index.containsKey(key)) {
            return false;
        }
        try {
            Files.deleteIfExists(pathFor(key));
        } catch (IOException e) {
            throw new StorageException("Failed to delete flat entry " + key, e);
        }
        forget(key);
        return true;
    }

    /**
     * @return all keys in ascending order
     */
    public synchronized List<String> keys() {
        ensureOpen();
        return new ArrayList<>(index.keySet());
    }

    /**
     * @return keys starting with {@code prefix}, in ascending order
     */
    public synchronized List<String> keysWithPrefix(String prefix) {
        ensureOpen();
        List<String> result = new ArrayList<>();
        for (String key : index.tailMap(prefix, true).keySet()) {
            if (!key.startsWith(prefix)) {
                break;
            }
            result.add(key);
        }
        return result;
    }

    public synchronized int size() {
        return index.size();
    }

    public synchronized long usedBytes() {
        return usedBytes;
    }

    public long quotaBytes() {
        return config.getQuotaBytes();
    }

    public FlatStoreConfig getConfig() {
        return config;
    }

    @Override
    public synchronized void close() {
        if (open) {
            open = false;
            index.clear();
            usedBytes = 0;
            logger.debug("Flat store at {} closed", config.getDirectory());
        }
    }

    private void forget(String key) {
        Long size = index.remove(key);
        if (size != null) {
            usedBytes -= size;
        }
    }

    private void ensureOpen() {
        if (!open) {
            throw new IllegalStateException("Flat store is not open");
        }
    }

    private Path pathFor(String key) {
        String fileName = Base64.getUrlEncoder().withoutPadding().encodeToString(key.getBytes(UTF_8)) + ENTRY_SUFFIX;
        if (fileName.length() > MAX_FILE_NAME_LENGTH) {
            throw new StorageException("Key too long for flat store: " + key);
        }
        return config.getDirectory().resolve(fileName);
    }

    private static String decodeFileName(String fileName) {
        String encoded = fileName.substring(0, fileName.length() - ENTRY_SUFFIX.length());
        return new String(Base64.getUrlDecoder().decode(encoded), UTF_8);
    }
}
