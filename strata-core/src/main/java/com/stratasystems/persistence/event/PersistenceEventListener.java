package com.stratasystems.persistence.event;

@FunctionalInterface
public interface PersistenceEventListener {

    void onEvent(PersistenceEvent event);
}
