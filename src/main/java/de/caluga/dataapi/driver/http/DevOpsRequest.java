package de.caluga.dataapi.driver.http;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST style request against the DevOps API, path relative to its base url
 */
public class DevOpsRequest {
    private final String method;
    private final String path;
    private Map<String, Object> data;
    private Map<String, Object> params;

    public DevOpsRequest(String method, String path) {
        this.method = method;
        this.path = path;
    }

    public static DevOpsRequest get(String path) {
        return new DevOpsRequest("GET", path);
    }

    public static DevOpsRequest post(String path) {
        return new DevOpsRequest("POST", path);
    }

    public static DevOpsRequest delete(String path) {
        return new DevOpsRequest("DELETE", path);
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public DevOpsRequest setData(Map<String, Object> data) {
        this.data = data;
        return this;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public DevOpsRequest setParams(Map<String, Object> params) {
        this.params = params;
        return this;
    }

    public DevOpsRequest addParam(String key, Object value) {
        if (value == null) return this;
        if (params == null) params = new LinkedHashMap<>();
        params.put(key, value);
        return this;
    }

    @Override
    public String toString() {
        return method + " " + path;
    }
}
