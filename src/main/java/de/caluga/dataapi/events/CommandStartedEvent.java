package de.caluga.dataapi.events;

import java.util.Map;

public class CommandStartedEvent extends CommandEvent {
    private final Map<String, Object> timeout;

    public CommandStartedEvent(String requestId, Map<String, Object> command, String keyspace, String collection, String url, Map<String, Object> timeout) {
        super("CommandStarted", requestId, command, keyspace, collection, url);
        this.timeout = timeout;
    }

    public Map<String, Object> getTimeout() {
        return timeout;
    }

    @Override
    public DataApiEventType getType() {
        return DataApiEventType.COMMAND_STARTED;
    }

    @Override
    protected String describe() {
        return target();
    }

    @Override
    protected void addFields(Map<String, Object> fields) {
        super.addFields(fields);
        fields.put("timeout", timeout);
    }
}
