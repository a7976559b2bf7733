package com.stratasystems.service;

import com.stratasystems.persistence.StorageException;

/**
 * Failure reported by the persistence service when no tier, and not the sync queue either,
 * could take an operation.
 */
public class PersistenceException extends StorageException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
