package de.caluga.dataapi.events;

import de.caluga.dataapi.driver.http.DevOpsRequest;

import java.util.Map;

public class AdminCommandPollingEvent extends AdminCommandEvent {
    private final long elapsed;
    private final long interval;

    public AdminCommandPollingEvent(String requestId, DevOpsRequest req, long elapsed, long interval) {
        super("AdminCommandPolling", requestId, req, true);
        this.elapsed = elapsed;
        this.interval = interval;
    }

    /**
     * ms since the initial request was sent
     */
    public long getElapsed() {
        return elapsed;
    }

    public long getInterval() {
        return interval;
    }

    @Override
    public DataApiEventType getType() {
        return DataApiEventType.ADMIN_COMMAND_POLLING;
    }

    @Override
    protected String describe() {
        return target() + " (poll interval " + interval + "ms, elapsed " + elapsed + "ms)";
    }

    @Override
    protected void addFields(Map<String, Object> fields) {
        super.addFields(fields);
        fields.put("elapsed", elapsed);
        fields.put("interval", interval);
    }
}
