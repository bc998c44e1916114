package de.caluga.dataapi.events;

import java.util.Map;

public class CommandFailedEvent extends CommandEvent {
    private final long duration;
    private final Throwable error;

    public CommandFailedEvent(String requestId, Map<String, Object> command, String keyspace, String collection, String url, Throwable error, long duration) {
        super("CommandFailed", requestId, command, keyspace, collection, url);
        this.error = error;
        this.duration = duration;
    }

    public long getDuration() {
        return duration;
    }

    public Throwable getError() {
        return error;
    }

    @Override
    public DataApiEventType getType() {
        return DataApiEventType.COMMAND_FAILED;
    }

    @Override
    protected String describe() {
        return target() + " (took " + duration + "ms) - '" + error.getMessage() + "'";
    }

    @Override
    protected void addFields(Map<String, Object> fields) {
        super.addFields(fields);
        fields.put("duration", duration);
        fields.put("error", error.getClass().getSimpleName() + ": " + error.getMessage());
    }
}
