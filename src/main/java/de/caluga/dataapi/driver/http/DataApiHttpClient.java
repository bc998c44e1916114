package de.caluga.dataapi.driver.http;

import de.caluga.dataapi.config.ConnectionSettings;
import de.caluga.dataapi.driver.CollectionNotFoundException;
import de.caluga.dataapi.driver.DataApiAuthenticationException;
import de.caluga.dataapi.driver.DataApiDriverException;
import de.caluga.dataapi.driver.DataApiHttpException;
import de.caluga.dataapi.driver.DataApiResponseException;
import de.caluga.dataapi.driver.DetailedErrorDescriptor;
import de.caluga.dataapi.driver.Doc;
import de.caluga.dataapi.driver.ErrorDescriptor;
import de.caluga.dataapi.driver.commands.DataApiCommand;
import de.caluga.dataapi.driver.serdes.DataApiJson;
import de.caluga.dataapi.driver.timeouts.TimeoutManager;
import de.caluga.dataapi.driver.timeouts.Timeouts;
import de.caluga.dataapi.events.CommandFailedEvent;
import de.caluga.dataapi.events.CommandStartedEvent;
import de.caluga.dataapi.events.CommandSucceededEvent;
import de.caluga.dataapi.events.CommandWarningsEvent;
import de.caluga.dataapi.events.EventLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Sends Data API commands: <code>POST {baseUrl}/{keyspace}[/{collection}]</code> with a single key JSON object as body.
 * Holds no state between calls besides its configuration.
 */
public class DataApiHttpClient extends AbstractHttpClient {
    public static final String TOKEN_HEADER = "Token";
    public static final String EMBEDDING_HEADER = "x-embedding-api-key";
    public static final String INVALID_TOKEN_MESSAGE = "UNAUTHENTICATED: Invalid token";
    public static final String COLLECTION_NOT_EXIST = "COLLECTION_NOT_EXIST";

    private final Logger log = LoggerFactory.getLogger(DataApiHttpClient.class);
    private final String defaultKeyspace;
    private final boolean forceHttp1;

    public DataApiHttpClient(ConnectionSettings cs, Fetcher fetcher, EventLogger eventLogger, Timeouts timeouts, DataApiJson json) {
        this(cs.getBaseUrl(), cs.getKeyspace(), cs.getHttpVersion() == 1, fetcher, eventLogger, timeouts, json, headersFor(cs));
    }

    private DataApiHttpClient(String baseUrl, String defaultKeyspace, boolean forceHttp1, Fetcher fetcher, EventLogger eventLogger, Timeouts timeouts, DataApiJson json, Map<String, String> headers) {
        super(baseUrl, fetcher, eventLogger, timeouts, json, headers);
        this.defaultKeyspace = defaultKeyspace;
        this.forceHttp1 = forceHttp1;
    }

    private static Map<String, String> headersFor(ConnectionSettings cs) {
        Map<String, String> h = new LinkedHashMap<>();
        if (cs.getToken() != null) h.put(TOKEN_HEADER, cs.getToken());
        if (cs.getEmbeddingApiKey() != null) h.put(EMBEDDING_HEADER, cs.getEmbeddingApiKey());
        if (cs.getUserAgent() != null) h.put("User-Agent", cs.getUserAgent());
        return h;
    }

    /**
     * same connection, events go to the given logger (and its emitter)
     */
    public DataApiHttpClient withEventLogger(EventLogger logger) {
        return new DataApiHttpClient(baseUrl, defaultKeyspace, forceHttp1, fetcher, logger, timeouts, json, baseHeaders);
    }

    public String getDefaultKeyspace() {
        return defaultKeyspace;
    }

    public DataApiResponse execute(DataApiCommand<?> cmd, TimeoutManager tm) {
        return executeCommand(cmd.asMap(), cmd.getKeyspace(), cmd.getCollection(), tm);
    }

    /**
     * @param command    single key map, the key being the command name
     * @param keyspace   null for the default keyspace
     * @param collection null for keyspace level commands
     */
    public DataApiResponse executeCommand(Map<String, Object> command, String keyspace, String collection, TimeoutManager tm) {
        String ks = keyspace == null ? defaultKeyspace : keyspace;
        String url = baseUrl + "/" + ks + (collection != null ? "/" + collection : "");
        return doExecute(command, ks, collection, url, tm);
    }

    /**
     * for commands addressing no keyspace, like <code>createKeyspace</code>: posted to the base url
     */
    public DataApiResponse executeGlobalCommand(Map<String, Object> command, TimeoutManager tm) {
        return doExecute(command, null, null, baseUrl, tm);
    }

    private DataApiResponse doExecute(Map<String, Object> command, String ks, String collection, String url, TimeoutManager tm) {
        String requestId = UUID.randomUUID().toString();
        long started = timeouts.getTimeSource().currentTimeMillis();
        eventLogger.dispatch(new CommandStartedEvent(requestId, command, ks, collection, url, timeoutsAsMap(tm)));
        DataApiResponse response;

        try {
            String body = json.serialize(command);
            FetcherResponse resp = request(new HttpRequestInfo(url, "POST", body, forceHttp1, tm));

            if (resp.getStatus() >= 400 && resp.getStatus() != 401) {
                throw new DataApiHttpException(resp.getStatus(), resp.getBody());
            }

            if (resp.getStatus() == 401) {
                Map<String, Object> faux = Doc.of("errors", List.of(Doc.of("message", DataApiAuthenticationException.MESSAGE)));
                throw new DataApiAuthenticationException(List.of(DetailedErrorDescriptor.fromResponse(command, faux)));
            }

            response = new DataApiResponse(json.deserializeResponse(resp.getBody()));
            List<Object> warnings = response.getStatus().getList("warnings");

            if (warnings != null && !warnings.isEmpty()) {
                List<ErrorDescriptor> descriptors = new ArrayList<>();

                for (Object w : warnings) {
                    if (w instanceof Map) {
                        descriptors.add(ErrorDescriptor.fromMap(Doc.asMap(w)));
                    } else if (w != null) {
                        descriptors.add(new ErrorDescriptor(null, w.toString(), null));
                    }
                }

                log.warn("Command {} on {} returned warnings: {}", commandName(command), url, descriptors);
                eventLogger.dispatch(new CommandWarningsEvent(requestId, command, ks, collection, url, descriptors));
            }

            List<Map<String, Object>> errors = response.getErrors();

            if (!errors.isEmpty()) {
                throw classify(command, ks, response, errors.get(0));
            }
        } catch (RuntimeException e) {
            if (e instanceof DataApiDriverException) {
                DataApiDriverException de = (DataApiDriverException) e;
                if (de.getKeyspace() == null) de.setKeyspace(ks);
                if (de.getCollection() == null) de.setCollection(collection);
                if (de.getCommand() == null) de.setCommand(command);
            }

            eventLogger.dispatch(new CommandFailedEvent(requestId, command, ks, collection, url, e, timeouts.getTimeSource().currentTimeMillis() - started));
            throw e;
        }

        // outside the try, a failing listener must not turn a success into commandFailed
        eventLogger.dispatch(new CommandSucceededEvent(requestId, command, ks, collection, url, response.getRaw(), timeouts.getTimeSource().currentTimeMillis() - started));
        return response;
    }

    private DataApiResponseException classify(Map<String, Object> command, String keyspace, DataApiResponse response, Map<String, Object> first) {
        List<DetailedErrorDescriptor> details = List.of(DetailedErrorDescriptor.fromResponse(command, response.getRaw()));
        Object message = first == null ? null : first.get("message");

        if (INVALID_TOKEN_MESSAGE.equals(message)) {
            return new DataApiAuthenticationException(details);
        }

        if (first != null && COLLECTION_NOT_EXIST.equals(first.get("errorCode"))) {
            String msg = message == null ? "" : message.toString();
            String[] parts = msg.split(": ");
            String name = parts.length > 1 ? parts[1] : msg;
            return new CollectionNotFoundException(keyspace, name, details);
        }

        return new DataApiResponseException(details);
    }

    private static String commandName(Map<String, Object> command) {
        return command == null || command.isEmpty() ? null : command.keySet().iterator().next();
    }

    private static Map<String, Object> timeoutsAsMap(TimeoutManager tm) {
        Map<String, Object> ret = new LinkedHashMap<>();
        tm.initial().forEach((k, v) -> ret.put(k.getKey(), v));
        return ret;
    }
}
