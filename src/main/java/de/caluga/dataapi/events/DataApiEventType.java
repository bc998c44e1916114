package de.caluga.dataapi.events;

/**
 * all events the clients emit, by their listener name
 */
public enum DataApiEventType {
    COMMAND_STARTED("commandStarted"),
    COMMAND_SUCCEEDED("commandSucceeded"),
    COMMAND_FAILED("commandFailed"),
    COMMAND_WARNINGS("commandWarnings"),
    ADMIN_COMMAND_STARTED("adminCommandStarted"),
    ADMIN_COMMAND_POLLING("adminCommandPolling"),
    ADMIN_COMMAND_SUCCEEDED("adminCommandSucceeded"),
    ADMIN_COMMAND_FAILED("adminCommandFailed"),
    ADMIN_COMMAND_WARNINGS("adminCommandWarnings");

    private final String eventName;

    DataApiEventType(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }

    public boolean isAdmin() {
        return eventName.startsWith("admin");
    }

    public static DataApiEventType fromName(String name) {
        for (DataApiEventType t : values()) {
            if (t.eventName.equals(name)) return t;
        }

        throw new IllegalArgumentException("Unknown event '" + name + "'");
    }
}
