package de.caluga.dataapi.admin;

import de.caluga.dataapi.driver.DataApiDriverException;
import de.caluga.dataapi.driver.Doc;
import de.caluga.dataapi.driver.http.DevOpsApiHttpClient;
import de.caluga.dataapi.driver.http.DevOpsRequest;
import de.caluga.dataapi.driver.http.DevOpsResponse;
import de.caluga.dataapi.driver.http.LongRunningRequest;
import de.caluga.dataapi.driver.timeouts.TimeoutCategory;
import de.caluga.dataapi.driver.timeouts.TimeoutOverride;
import de.caluga.dataapi.events.DataApiEventListener;
import de.caluga.dataapi.events.DataApiEventType;
import de.caluga.dataapi.events.HierarchicalEmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * database lifecycle through the DevOps API
 */
public class AstraAdmin {
    public static final long DATABASE_POLL_INTERVAL_MS = 10000;

    private final Logger log = LoggerFactory.getLogger(AstraAdmin.class);
    private final DevOpsApiHttpClient httpClient;
    private final HierarchicalEmitter emitter;

    public AstraAdmin(DevOpsApiHttpClient httpClient, HierarchicalEmitter emitter) {
        this.httpClient = httpClient;
        this.emitter = emitter;
    }

    public HierarchicalEmitter getEmitter() {
        return emitter;
    }

    public DataApiEventListener on(DataApiEventType type, DataApiEventListener listener) {
        return emitter.on(type, listener);
    }

    public List<Map<String, Object>> listDatabases() {
        return listDatabases(null, null);
    }

    public List<Map<String, Object>> listDatabases(ListDatabasesOptions options, TimeoutOverride timeout) {
        DevOpsRequest req = DevOpsRequest.get("/databases");

        if (options != null) {
            req.addParam("include", options.getInclude())
               .addParam("provider", options.getProvider())
               .addParam("limit", options.getLimit())
               .addParam("starting_after", options.getSkip());
        }

        DevOpsResponse resp = httpClient.request(req, httpClient.timeouts().single(TimeoutCategory.DATABASE_ADMIN, timeout));

        if (!(resp.getData() instanceof List)) {
            throw new DataApiDriverException("Unexpected response listing databases: " + resp.getData());
        }

        return Doc.convertToMapList((List<?>) resp.getData());
    }

    public Map<String, Object> dbInfo(String id) {
        return dbInfo(id, null);
    }

    public Map<String, Object> dbInfo(String id, TimeoutOverride timeout) {
        DevOpsResponse resp = httpClient.request(DevOpsRequest.get("/databases/" + id), httpClient.timeouts().single(TimeoutCategory.DATABASE_ADMIN, timeout));
        return resp.getDataDoc();
    }

    /**
     * Creates a database and, unless non blocking, waits until it is <code>ACTIVE</code>.
     * The config needs at least <code>name</code>, <code>cloudProvider</code> and <code>region</code>,
     * <code>capacityUnits</code>, <code>tier</code> and <code>dbType</code> default to a serverless vector database.
     *
     * @return admin of the new database
     */
    public AstraDbAdmin createDatabase(Map<String, Object> config, AdminBlockingOptions options) {
        Doc body = Doc.of("capacityUnits", 1, "tier", "serverless", "dbType", "vector");
        body.putAll(config);
        DevOpsRequest req = DevOpsRequest.post("/databases").setData(body);
        LongRunningRequest lr = new LongRunningRequest(AstraAdmin::idFromLocation, "ACTIVE", List.of("INITIALIZING", "PENDING"),
                DATABASE_POLL_INTERVAL_MS, TimeoutCategory.DATABASE_ADMIN, options);
        DevOpsResponse resp = httpClient.requestLongRunning(req, lr);
        String id = idFromLocation(resp);
        log.info("Created database {} ({})", config.get("name"), id);
        return dbAdmin(id);
    }

    /**
     * terminates the database and, unless non blocking, waits until it is <code>TERMINATED</code>
     */
    public void dropDatabase(String id, AdminBlockingOptions options) {
        DevOpsRequest req = DevOpsRequest.post("/databases/" + id + "/terminate");
        LongRunningRequest lr = new LongRunningRequest(id, "TERMINATED", List.of("TERMINATING"),
                DATABASE_POLL_INTERVAL_MS, TimeoutCategory.DATABASE_ADMIN, options);
        httpClient.requestLongRunning(req, lr);
    }

    public AstraDbAdmin dbAdmin(String id) {
        return new AstraDbAdmin(id, this, httpClient);
    }

    static String idFromLocation(DevOpsResponse resp) {
        String location = resp.getHeader("Location");

        if (location == null || location.isEmpty()) {
            throw new DataApiDriverException("No Location header in response, cannot determine id of the new database");
        }

        return location.substring(location.lastIndexOf('/') + 1);
    }
}
