package de.caluga.dataapi.events;

import de.caluga.dataapi.driver.http.DevOpsRequest;

import java.util.Map;

public class AdminCommandFailedEvent extends AdminCommandEvent {
    private final long duration;
    private final Throwable error;

    public AdminCommandFailedEvent(String requestId, DevOpsRequest req, boolean longRunning, Throwable error, long duration) {
        super("AdminCommandFailed", requestId, req, longRunning);
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
        return DataApiEventType.ADMIN_COMMAND_FAILED;
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
