package de.caluga.dataapi.events;

import de.caluga.dataapi.driver.http.DevOpsRequest;

import java.util.Map;

public class AdminCommandStartedEvent extends AdminCommandEvent {
    private final long timeout;

    public AdminCommandStartedEvent(String requestId, DevOpsRequest req, boolean longRunning, long timeout) {
        super("AdminCommandStarted", requestId, req, longRunning);
        this.timeout = timeout;
    }

    public long getTimeout() {
        return timeout;
    }

    @Override
    public DataApiEventType getType() {
        return DataApiEventType.ADMIN_COMMAND_STARTED;
    }

    @Override
    protected String describe() {
        return target() + " (timeout " + timeout + "ms)";
    }

    @Override
    protected void addFields(Map<String, Object> fields) {
        super.addFields(fields);
        fields.put("timeout", timeout);
    }
}
