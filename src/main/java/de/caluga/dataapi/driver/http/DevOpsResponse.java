package de.caluga.dataapi.driver.http;

import de.caluga.dataapi.driver.Doc;

import java.util.Map;

public class DevOpsResponse {
    private final Object data;
    private final int status;
    private final Map<String, String> headers;

    public DevOpsResponse(Object data, int status, Map<String, String> headers) {
        this.data = data;
        this.status = status;
        this.headers = headers;
    }

    /**
     * parsed body: a map, a list, or the plain body text if it was no JSON
     */
    public Object getData() {
        return data;
    }

    /**
     * body as object, null if it is none
     */
    public Doc getDataDoc() {
        Map<String, Object> m = Doc.asMap(data);
        return m == null ? null : Doc.of(m);
    }

    public int getStatus() {
        return status;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getHeader(String name) {
        return headers == null ? null : headers.get(name);
    }
}
