package de.caluga.dataapi.driver.http;

import de.caluga.dataapi.driver.serdes.DataApiJson;
import de.caluga.dataapi.driver.timeouts.TimeoutManager;
import de.caluga.dataapi.driver.timeouts.Timeouts;
import de.caluga.dataapi.events.EventLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * common part of the Data API and DevOps API clients: header handling and the
 * timeout check done before every request
 */
public abstract class AbstractHttpClient {
    private final Logger log = LoggerFactory.getLogger(AbstractHttpClient.class);

    protected final String baseUrl;
    protected final Fetcher fetcher;
    protected final EventLogger eventLogger;
    protected final Timeouts timeouts;
    protected final DataApiJson json;
    protected final Map<String, String> baseHeaders;

    protected AbstractHttpClient(String baseUrl, Fetcher fetcher, EventLogger eventLogger, Timeouts timeouts, DataApiJson json, Map<String, String> baseHeaders) {
        this.baseUrl = baseUrl;
        this.fetcher = fetcher;
        this.eventLogger = eventLogger;
        this.timeouts = timeouts;
        this.json = json;
        this.baseHeaders = baseHeaders;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Timeouts timeouts() {
        return timeouts;
    }

    public EventLogger getEventLogger() {
        return eventLogger;
    }

    public DataApiJson getJson() {
        return json;
    }

    /**
     * fails fast, without calling the fetcher, when the timeout manager has no time left
     */
    protected FetcherResponse request(HttpRequestInfo info) {
        TimeoutManager.Advance advance = info.getTimeoutManager().advance(info);

        if (advance.isExpired()) {
            log.debug("No time left for {} {}", info.getMethod(), info.getUrl());
            throw advance.mkTimeoutError();
        }

        Map<String, String> headers = new LinkedHashMap<>(baseHeaders);
        if (info.getBody() != null) headers.put("Content-Type", "application/json");
        log.debug("{} {} (timeout {}ms)", info.getMethod(), info.getUrl(), advance.getMsRemaining());
        return fetcher.fetch(new FetcherRequest(info.getUrl(), info.getMethod(), info.getBody(), headers, advance.getMsRemaining(), info.isForceHttp1(), advance::mkTimeoutError));
    }
}
