package de.caluga.dataapi.events;

import de.caluga.dataapi.driver.http.DevOpsRequest;

import java.util.Map;

public class AdminCommandSucceededEvent extends AdminCommandEvent {
    private final long duration;
    private final Object resBody;

    public AdminCommandSucceededEvent(String requestId, DevOpsRequest req, boolean longRunning, Object resBody, long duration) {
        super("AdminCommandSucceeded", requestId, req, longRunning);
        this.resBody = resBody;
        this.duration = duration;
    }

    public long getDuration() {
        return duration;
    }

    public Object getResBody() {
        return resBody;
    }

    @Override
    public DataApiEventType getType() {
        return DataApiEventType.ADMIN_COMMAND_SUCCEEDED;
    }

    @Override
    protected String describe() {
        return target() + " (took " + duration + "ms)";
    }

    @Override
    protected void addFields(Map<String, Object> fields) {
        super.addFields(fields);
        fields.put("duration", duration);
        fields.put("resBody", resBody);
    }
}
