package de.caluga.dataapi.driver.http;

import java.util.Map;
import java.util.function.Supplier;

public class FetcherRequest {
    private final String url;
    private final String method;
    private final String body;
    private final Map<String, String> headers;
    private final long timeoutMs;
    private final boolean forceHttp1;
    private final Supplier<RuntimeException> timeoutError;

    public FetcherRequest(String url, String method, String body, Map<String, String> headers, long timeoutMs, boolean forceHttp1, Supplier<RuntimeException> timeoutError) {
        this.url = url;
        this.method = method;
        this.body = body;
        this.headers = headers;
        this.timeoutMs = timeoutMs;
        this.forceHttp1 = forceHttp1;
        this.timeoutError = timeoutError;
    }

    public String getUrl() {
        return url;
    }

    public String getMethod() {
        return method;
    }

    /**
     * null for requests without body
     */
    public String getBody() {
        return body;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public boolean isForceHttp1() {
        return forceHttp1;
    }

    public RuntimeException mkTimeoutError() {
        return timeoutError.get();
    }

    @Override
    public String toString() {
        return method + " " + url + " (timeout " + timeoutMs + "ms)";
    }
}
