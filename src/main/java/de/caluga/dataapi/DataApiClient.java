package de.caluga.dataapi;

import de.caluga.dataapi.admin.AstraAdmin;
import de.caluga.dataapi.config.ConnectionSettings;
import de.caluga.dataapi.config.DataApiConfig;
import de.caluga.dataapi.driver.DataApiTimeoutException;
import de.caluga.dataapi.driver.http.DataApiHttpClient;
import de.caluga.dataapi.driver.http.DevOpsApiHttpClient;
import de.caluga.dataapi.driver.http.Fetcher;
import de.caluga.dataapi.driver.http.JdkHttpFetcher;
import de.caluga.dataapi.driver.serdes.DataApiJson;
import de.caluga.dataapi.driver.serdes.NumericCoercionPolicy;
import de.caluga.dataapi.driver.timeouts.TimeSource;
import de.caluga.dataapi.driver.timeouts.Timeouts;
import de.caluga.dataapi.events.DataApiEventListener;
import de.caluga.dataapi.events.DataApiEventType;
import de.caluga.dataapi.events.EventLogger;
import de.caluga.dataapi.events.HierarchicalEmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: creates {@link Db}s for Data API endpoints and the {@link AstraAdmin} for the DevOps API.
 * Root of the event hierarchy, listeners registered here see the events of all dbs and collections.
 * <pre>
 *     DataApiClient client = new DataApiClient("AstraCS:...", new DataApiConfig());
 *     Collection c = client.db("https://...apps.astra.datastax.com").collection("users");
 * </pre>
 */
public class DataApiClient implements AutoCloseable {
    private final Logger log = LoggerFactory.getLogger(DataApiClient.class);

    private final DataApiConfig config;
    private final Fetcher fetcher;
    private final TimeSource timeSource;
    private final HierarchicalEmitter emitter = new HierarchicalEmitter(null);
    private final EventLogger eventLogger;
    private final DataApiJson json;

    public DataApiClient(String token, DataApiConfig config) {
        this(withToken(config, token), new JdkHttpFetcher(), TimeSource.system(), null);
    }

    /**
     * @param fetcher    http transport
     * @param timeSource clock for timeouts and polling
     * @param policy     numeric coercion for documents read, null for plain numbers
     */
    public DataApiClient(DataApiConfig config, Fetcher fetcher, TimeSource timeSource, NumericCoercionPolicy policy) {
        this.config = config == null ? new DataApiConfig() : config;
        this.fetcher = fetcher;
        this.timeSource = timeSource == null ? TimeSource.system() : timeSource;
        this.eventLogger = new EventLogger(emitter, this.config.loggingSettings());
        this.json = new DataApiJson(policy);
    }

    private static DataApiConfig withToken(DataApiConfig config, String token) {
        DataApiConfig ret = config == null ? new DataApiConfig() : config.copy();
        if (token != null) ret.connectionSettings().setToken(token);
        return ret;
    }

    public DataApiConfig getConfig() {
        return config;
    }

    public HierarchicalEmitter getEmitter() {
        return emitter;
    }

    public DataApiEventListener on(DataApiEventType type, DataApiEventListener listener) {
        return emitter.on(type, listener);
    }

    public void off(DataApiEventType type, DataApiEventListener listener) {
        emitter.off(type, listener);
    }

    /**
     * db at the endpoint of the configuration, its keyspace
     */
    public Db db() {
        return db(config.connectionSettings().getEndpoint(), null);
    }

    public Db db(String endpoint) {
        return db(endpoint, null);
    }

    /**
     * @param keyspace null for the keyspace of the configuration
     */
    public Db db(String endpoint, String keyspace) {
        if (endpoint == null) {
            throw new IllegalArgumentException("No endpoint given");
        }

        ConnectionSettings cs = config.connectionSettings().copy();
        cs.setEndpoint(endpoint);
        if (keyspace != null) cs.setKeyspace(keyspace);
        HierarchicalEmitter dbEmitter = new HierarchicalEmitter(emitter);
        EventLogger dbLogger = eventLogger.forChild(dbEmitter, null);
        Timeouts timeouts = new Timeouts(DataApiTimeoutException::new, config.timeoutSettings().toDescriptor(), timeSource);
        DataApiHttpClient http = new DataApiHttpClient(cs, fetcher, dbLogger, timeouts, json);
        log.debug("New db for {}, keyspace {}", cs.getBaseUrl(), cs.getKeyspace());
        return new Db(this, cs.getKeyspace(), http, dbEmitter);
    }

    /**
     * admin of the DevOps API, using the admin token of the configuration or the token of the client
     */
    public AstraAdmin admin() {
        String token = config.adminSettings().getAdminToken();
        if (token == null) token = config.connectionSettings().getToken();
        HierarchicalEmitter adminEmitter = new HierarchicalEmitter(emitter);
        DevOpsApiHttpClient http = new DevOpsApiHttpClient(config.adminSettings().getDevOpsEndpoint(), token, config.connectionSettings().getUserAgent(), fetcher,
                eventLogger.forChild(adminEmitter, null), DevOpsApiHttpClient.mkTimeouts(config.timeoutSettings().toDescriptor(), timeSource), json,
                config.adminSettings().getMaxPollingTimeMs());
        return new AstraAdmin(http, adminEmitter);
    }

    @Override
    public void close() {
        fetcher.close();
    }
}
