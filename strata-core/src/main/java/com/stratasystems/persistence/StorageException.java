package com.stratasystems.persistence;

/**
 * Base exception for storage backend failures.
 * Provides specific exception types for the failure modes the orchestrator reacts to.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when a backend has no usable handle, is unreachable or timed out.
     * The orchestrator treats it as a signal to move along the fallback chain.
     */
    public static class BackendUnavailableException extends StorageException {
        private final BackendKind backend;

        public BackendUnavailableException(BackendKind backend, String message) {
            super(String.format("[%s] %s", backend.id(), message));
            this.backend = backend;
        }

        public BackendUnavailableException(BackendKind backend, String message, Throwable cause) {
            super(String.format("[%s] %s", backend.id(), message), cause);
            this.backend = backend;
        }

        public BackendKind getBackend() {
            return backend;
        }
    }

    /**
     * Thrown when a capacity-constrained store cannot fit a write.
     */
    public static class QuotaExceededException extends StorageException {
        private final long requiredBytes;
        private final long quotaBytes;

        public QuotaExceededException(long requiredBytes, long quotaBytes) {
            super(String.format("Write of %d bytes exceeds storage quota (%d bytes)",
                requiredBytes, quotaBytes));
            this.requiredBytes = requiredBytes;
            this.quotaBytes = quotaBytes;
        }

        public long getRequiredBytes() {
            return requiredBytes;
        }

        public long getQuotaBytes() {
            return quotaBytes;
        }
    }

    /**
     * Thrown when stored bytes cannot be parsed back into a record.
     */
    public static class CorruptedRecordException extends StorageException {
        private final String recordKey;

        public CorruptedRecordException(String message, String recordKey) {
            super(String.format("%s (key: %s)", message, recordKey));
            this.recordKey = recordKey;
        }

        public CorruptedRecordException(String message, String recordKey, Throwable cause) {
            super(String.format("%s (key: %s)", message, recordKey), cause);
            this.recordKey = recordKey;
        }

        public String getRecordKey() {
            return recordKey;
        }
    }

    /**
     * Thrown when a serialized record exceeds what a backend can store in one entry.
     */
    public static class RecordTooLargeException extends StorageException {
        private final long recordSize;
        private final long maxSize;

        public RecordTooLargeException(long recordSize, long maxSize) {
            super(String.format("Record size (%d bytes) exceeds maximum allowed size (%d bytes)",
                recordSize, maxSize));
            this.recordSize = recordSize;
            this.maxSize = maxSize;
        }

        public long getRecordSize() {
            return recordSize;
        }

        public long getMaxSize() {
            return maxSize;
        }
    }

    /**
     * Thrown when a transaction fails to commit.
     * This may indicate storage issues or lock contention.
     */
    public static class TransactionFailedException extends StorageException {
        public TransactionFailedException(String message) {
            super(message);
        }

        public TransactionFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
