package de.caluga.dataapi.driver.http;

import de.caluga.dataapi.driver.DataApiDriverException;
import de.caluga.dataapi.driver.DevOpsApiResponseException;
import de.caluga.dataapi.driver.DevOpsApiTimeoutException;
import de.caluga.dataapi.driver.DevOpsUnexpectedStateException;
import de.caluga.dataapi.driver.Doc;
import de.caluga.dataapi.driver.serdes.DataApiJson;
import de.caluga.dataapi.driver.timeouts.TimeSource;
import de.caluga.dataapi.driver.timeouts.TimedOutCategories;
import de.caluga.dataapi.driver.timeouts.TimeoutCategory;
import de.caluga.dataapi.driver.timeouts.TimeoutDescriptor;
import de.caluga.dataapi.driver.timeouts.TimeoutManager;
import de.caluga.dataapi.driver.timeouts.Timeouts;
import de.caluga.dataapi.events.AdminCommandFailedEvent;
import de.caluga.dataapi.events.AdminCommandPollingEvent;
import de.caluga.dataapi.events.AdminCommandStartedEvent;
import de.caluga.dataapi.events.AdminCommandSucceededEvent;
import de.caluga.dataapi.events.EventLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Client for the DevOps API. Always talks HTTP/1.1 and authenticates with a bearer token.
 * Long running operations are polled via <code>GET /databases/{id}</code> until they reach their target state,
 * the only way to stop waiting is the timeout of the operation.
 */
public class DevOpsApiHttpClient extends AbstractHttpClient {
    private final Logger log = LoggerFactory.getLogger(DevOpsApiHttpClient.class);
    private final long defaultMaxTimeMs;

    public DevOpsApiHttpClient(String baseUrl, String token, String userAgent, Fetcher fetcher, EventLogger eventLogger, Timeouts timeouts, DataApiJson json, long defaultMaxTimeMs) {
        super(stripSlash(baseUrl), fetcher, eventLogger, timeouts, json, headersFor(token, userAgent));
        this.defaultMaxTimeMs = defaultMaxTimeMs;
    }

    /**
     * timeouts whose errors are {@link DevOpsApiTimeoutException}s
     */
    public static Timeouts mkTimeouts(TimeoutDescriptor base, TimeSource timeSource) {
        return new Timeouts(DevOpsApiTimeoutException::new, base, timeSource);
    }

    private static Map<String, String> headersFor(String token, String userAgent) {
        Map<String, String> h = new LinkedHashMap<>();
        if (token != null) h.put("Authorization", "Bearer " + token);
        if (userAgent != null) h.put("User-Agent", userAgent);
        return h;
    }

    private static String stripSlash(String s) {
        return s != null && s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    public DevOpsResponse request(DevOpsRequest req, TimeoutManager tm) {
        String requestId = UUID.randomUUID().toString();
        long started = now();
        eventLogger.dispatch(new AdminCommandStartedEvent(requestId, req, false, firstTimeout(tm)));
        DevOpsResponse resp = doRequest(req, tm, false, requestId, started);
        eventLogger.dispatch(new AdminCommandSucceededEvent(requestId, req, false, resp.getData(), now() - started));
        return resp;
    }

    /**
     * initiating request, then polling until the target state is reached, unless the options say non blocking
     */
    public DevOpsResponse requestLongRunning(DevOpsRequest req, LongRunningRequest info) {
        TimeoutManager tm = longRunningTimeoutManager(info.getCategory(), info.getOptions().getTimeout());
        boolean blocking = info.getOptions().isBlocking();
        String requestId = UUID.randomUUID().toString();
        long started = now();
        eventLogger.dispatch(new AdminCommandStartedEvent(requestId, req, blocking, firstTimeout(tm)));
        DevOpsResponse resp = doRequest(req, tm, blocking, requestId, started);

        if (blocking) {
            awaitStatus(info.idFor(resp), req, info, tm, requestId, started);
        }

        eventLogger.dispatch(new AdminCommandSucceededEvent(requestId, req, blocking, resp.getData(), now() - started));
        return resp;
    }

    /**
     * one overall deadline for the initiating request and all polls
     */
    public TimeoutManager longRunningTimeoutManager(TimeoutCategory category, Long timeoutMs) {
        long overall = timeoutMs != null ? timeoutMs : defaultMaxTimeMs;
        if (overall == 0) overall = Timeouts.EFFECTIVELY_INFINITY;
        TimedOutCategories cats = timeoutMs != null ? TimedOutCategories.provided() : TimedOutCategories.of(category);
        Map<TimeoutCategory, Long> initial = new EnumMap<>(TimeoutCategory.class);
        initial.put(category, overall);
        AtomicLong startedAt = new AtomicLong(-1);
        long finalOverall = overall;
        TimeSource ts = timeouts.getTimeSource();

        return timeouts.custom(initial, () -> {
            startedAt.compareAndSet(-1, ts.currentTimeMillis());
            return new TimeoutManager.Advance.Raw(finalOverall - (ts.currentTimeMillis() - startedAt.get()), cats);
        });
    }

    private void awaitStatus(String id, DevOpsRequest req, LongRunningRequest info, TimeoutManager tm, String requestId, long started) {
        long pollInterval = info.getPollIntervalMs();

        for (;;) {
            DevOpsResponse resp = doRequest(DevOpsRequest.get("/databases/" + id), tm, true, requestId, started);
            Doc dbInfo = resp.getDataDoc();
            String status = dbInfo == null ? null : dbInfo.getString("status");

            if (info.getTarget().equals(status)) {
                log.debug("{} reached state {}", id, status);
                break;
            }

            if (!info.getLegalStates().contains(status)) {
                List<String> okStates = new ArrayList<>();
                okStates.add(info.getTarget());
                okStates.addAll(info.getLegalStates());
                DevOpsUnexpectedStateException error = new DevOpsUnexpectedStateException("Database " + id + " is not in any legal state [" + String.join(",", okStates) + "], but in " + status, okStates, dbInfo);
                eventLogger.dispatch(new AdminCommandFailedEvent(requestId, req, true, error, now() - started));
                throw error;
            }

            eventLogger.dispatch(new AdminCommandPollingEvent(requestId, req, now() - started, pollInterval));

            try {
                timeouts.getTimeSource().sleep(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                DataApiDriverException error = new DataApiDriverException("Interrupted while waiting for database " + id, e);
                eventLogger.dispatch(new AdminCommandFailedEvent(requestId, req, true, error, now() - started));
                throw error;
            }
        }
    }

    private DevOpsResponse doRequest(DevOpsRequest req, TimeoutManager tm, boolean longRunning, String requestId, long started) {
        String url = baseUrl + req.getPath() + query(req.getParams());

        try {
            String body = req.getData() == null ? null : json.serialize(req.getData());
            FetcherResponse resp = request(new HttpRequestInfo(url, req.getMethod(), body, true, tm));
            Object data = json.parseOrText(resp.getBody());

            if (resp.getStatus() >= 400) {
                throw new DevOpsApiResponseException(resp.getStatus(), data);
            }

            return new DevOpsResponse(data, resp.getStatus(), resp.getHeaders());
        } catch (RuntimeException e) {
            eventLogger.dispatch(new AdminCommandFailedEvent(requestId, req, longRunning, e, now() - started));
            throw e;
        }
    }

    private static String query(Map<String, Object> params) {
        if (params == null || params.isEmpty()) return "";
        StringBuilder b = new StringBuilder("?");

        for (Map.Entry<String, Object> e : params.entrySet()) {
            if (e.getValue() == null) continue;
            if (b.length() > 1) b.append('&');
            b.append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)).append('=').append(URLEncoder.encode(e.getValue().toString(), StandardCharsets.UTF_8));
        }

        return b.length() == 1 ? "" : b.toString();
    }

    private long now() {
        return timeouts.getTimeSource().currentTimeMillis();
    }

    private static long firstTimeout(TimeoutManager tm) {
        return tm.initial().values().stream().mapToLong(Long::longValue).min().orElse(0);
    }
}
