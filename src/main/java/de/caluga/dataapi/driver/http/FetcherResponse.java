package de.caluga.dataapi.driver.http;

import java.util.Map;
import java.util.TreeMap;

public class FetcherResponse {
    private final int status;
    private final String body;
    private final Map<String, String> headers;
    private final String httpVersion;

    public FetcherResponse(int status, String body, Map<String, String> headers, String httpVersion) {
        this.status = status;
        this.body = body;
        this.headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) this.headers.putAll(headers);
        this.httpVersion = httpVersion;
    }

    public FetcherResponse(int status, String body) {
        this(status, body, Map.of(), "HTTP/2");
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    /**
     * header names are case insensitive
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getHeader(String name) {
        return headers.get(name);
    }

    public String getHttpVersion() {
        return httpVersion;
    }
}
