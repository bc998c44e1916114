package de.caluga.dataapi.events;

import java.util.Map;

public class CommandSucceededEvent extends CommandEvent {
    private final long duration;
    private final Map<String, Object> response;

    public CommandSucceededEvent(String requestId, Map<String, Object> command, String keyspace, String collection, String url, Map<String, Object> response, long duration) {
        super("CommandSucceeded", requestId, command, keyspace, collection, url);
        this.response = response;
        this.duration = duration;
    }

    /**
     * ms from sending the request until the response was decoded
     */
    public long getDuration() {
        return duration;
    }

    public Map<String, Object> getResponse() {
        return response;
    }

    @Override
    public DataApiEventType getType() {
        return DataApiEventType.COMMAND_SUCCEEDED;
    }

    @Override
    protected String describe() {
        return target() + " (took " + duration + "ms)";
    }

    @Override
    protected void addFields(Map<String, Object> fields) {
        super.addFields(fields);
        fields.put("duration", duration);
        fields.put("response", response);
    }
}
