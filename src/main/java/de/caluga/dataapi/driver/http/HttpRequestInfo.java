package de.caluga.dataapi.driver.http;

import de.caluga.dataapi.driver.timeouts.RequestInfo;
import de.caluga.dataapi.driver.timeouts.TimeoutManager;

public class HttpRequestInfo implements RequestInfo {
    private final String url;
    private final String method;
    private final String body;
    private final boolean forceHttp1;
    private final TimeoutManager timeoutManager;

    public HttpRequestInfo(String url, String method, String body, boolean forceHttp1, TimeoutManager timeoutManager) {
        this.url = url;
        this.method = method;
        this.body = body;
        this.forceHttp1 = forceHttp1;
        this.timeoutManager = timeoutManager;
    }

    @Override
    public String getUrl() {
        return url;
    }

    @Override
    public String getMethod() {
        return method;
    }

    public String getBody() {
        return body;
    }

    public boolean isForceHttp1() {
        return forceHttp1;
    }

    public TimeoutManager getTimeoutManager() {
        return timeoutManager;
    }
}
