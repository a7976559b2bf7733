package com.stratasystems.service;

/**
 * Thrown when the service cannot start, most commonly because no backend is available.
 */
public class PersistenceInitializationException extends PersistenceException {

    public PersistenceInitializationException(String message) {
        super(message);
    }

    public PersistenceInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
