package com.stratasystems.persistence.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One published lifecycle event with its payload attributes.
 */
public final class PersistenceEvent {

    private final PersistenceEventType type;
    private final Instant timestamp;
    private final Map<String, Object> attributes;

    public PersistenceEvent(PersistenceEventType type, Map<String, ?> attributes) {
        this(type, Instant.now(), attributes);
    }

    public PersistenceEvent(PersistenceEventType type, Instant timestamp, Map<String, ?> attributes) {
        this.type = Objects.requireNonNull(type, "type");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static PersistenceEvent of(PersistenceEventType type) {
        return new PersistenceEvent(type, Map.of());
    }

    public PersistenceEventType getType() {
        return type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object get(String attribute) {
        return attributes.get(attribute);
    }

    @Override
    public String toString() {
        return "PersistenceEvent{" + type.topic() + ", " + attributes + '}';
    }
}
