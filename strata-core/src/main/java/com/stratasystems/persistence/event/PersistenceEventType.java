package com.stratasystems.persistence.event;

/**
 * Lifecycle events published by the persistence service.
 */
public enum PersistenceEventType {
    READY("persistence:ready"),
    SAVED("persistence:saved"),
    LOADED("persistence:loaded"),
    DELETED("persistence:deleted"),
    QUERIED("persistence:queried"),
    CLEARED("persistence:cleared"),
    SYNC_COMPLETED("persistence:sync_completed"),
    SYNC_ITEM_DROPPED("persistence:sync_item_dropped"),
    BACKEND_CHANGED("persistence:backend_changed"),
    ONLINE("persistence:online"),
    OFFLINE("persistence:offline"),
    MIGRATION_COMPLETED("persistence:migration_completed");

    private final String topic;

    PersistenceEventType(String topic) {
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }
}
