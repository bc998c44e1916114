package de.caluga.dataapi.events;

import de.caluga.dataapi.driver.http.DevOpsRequest;

import java.util.Map;

/**
 * events around requests to the DevOps API
 */
public abstract class AdminCommandEvent extends DataApiEvent {
    private final String path;
    private final String method;
    private final Map<String, Object> reqBody;
    private final Map<String, Object> params;
    private final boolean longRunning;

    protected AdminCommandEvent(String name, String requestId, DevOpsRequest req, boolean longRunning) {
        super(name, requestId);
        this.path = req.getPath();
        this.method = req.getMethod();
        this.reqBody = req.getData();
        this.params = req.getParams();
        this.longRunning = longRunning;
    }

    public String getPath() {
        return path;
    }

    public String getMethod() {
        return method;
    }

    public Map<String, Object> getReqBody() {
        return reqBody;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public boolean isLongRunning() {
        return longRunning;
    }

    protected String target() {
        return method + " " + path + (longRunning ? " (blocking)" : "");
    }

    @Override
    protected void addFields(Map<String, Object> fields) {
        fields.put("path", path);
        fields.put("method", method);
        fields.put("reqBody", reqBody);
        fields.put("params", params);
        fields.put("longRunning", longRunning);
    }
}
