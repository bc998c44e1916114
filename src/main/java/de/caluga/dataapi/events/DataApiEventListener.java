package de.caluga.dataapi.events;

@FunctionalInterface
public interface DataApiEventListener {
    void onEvent(DataApiEvent event);
}
