package de.caluga.dataapi.admin;

import de.caluga.dataapi.driver.Doc;
import de.caluga.dataapi.driver.http.DevOpsApiHttpClient;
import de.caluga.dataapi.driver.http.DevOpsRequest;
import de.caluga.dataapi.driver.http.LongRunningRequest;
import de.caluga.dataapi.driver.timeouts.TimeoutCategory;
import de.caluga.dataapi.driver.timeouts.TimeoutOverride;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * DevOps API administration of one database
 */
public class AstraDbAdmin {
    public static final long KEYSPACE_POLL_INTERVAL_MS = 1000;

    private final String id;
    private final AstraAdmin astraAdmin;
    private final DevOpsApiHttpClient httpClient;

    AstraDbAdmin(String id, AstraAdmin astraAdmin, DevOpsApiHttpClient httpClient) {
        this.id = id;
        this.astraAdmin = astraAdmin;
        this.httpClient = httpClient;
    }

    public String getId() {
        return id;
    }

    public Map<String, Object> info() {
        return info(null);
    }

    public Map<String, Object> info(TimeoutOverride timeout) {
        return astraAdmin.dbInfo(id, timeout);
    }

    public List<String> listKeyspaces() {
        return listKeyspaces(null);
    }

    /**
     * read from the database info, the DevOps API has no separate listing
     */
    public List<String> listKeyspaces(TimeoutOverride timeout) {
        Doc info = Doc.of(info(timeout));
        List<String> ret = new ArrayList<>();
        List<Object> keyspaces = info.getList("keyspaces");

        if (keyspaces != null) {
            for (Object o : keyspaces) {
                Map<String, Object> ks = Doc.asMap(o);
                ret.add(ks != null ? String.valueOf(ks.get("name")) : String.valueOf(o));
            }

            return ret;
        }

        Doc inner = info.getDoc("info");
        List<Object> names = inner == null ? null : inner.getList("keyspaces");

        if (names != null) {
            for (Object o : names) {
                ret.add(String.valueOf(o));
            }
        }

        return ret;
    }

    /**
     * creates the keyspace and, unless non blocking, waits until the database is <code>ACTIVE</code> again
     */
    public void createKeyspace(String name, AdminBlockingOptions options) {
        DevOpsRequest req = DevOpsRequest.post("/databases/" + id + "/keyspaces/" + name);
        httpClient.requestLongRunning(req, keyspaceChange(options));
    }

    public void dropKeyspace(String name, AdminBlockingOptions options) {
        DevOpsRequest req = DevOpsRequest.delete("/databases/" + id + "/keyspaces/" + name);
        httpClient.requestLongRunning(req, keyspaceChange(options));
    }

    public void drop(AdminBlockingOptions options) {
        astraAdmin.dropDatabase(id, options);
    }

    private LongRunningRequest keyspaceChange(AdminBlockingOptions options) {
        return new LongRunningRequest(id, "ACTIVE", List.of("MAINTENANCE"), KEYSPACE_POLL_INTERVAL_MS, TimeoutCategory.KEYSPACE_ADMIN, options);
    }

    @Override
    public String toString() {
        return "AstraDbAdmin{" + id + "}";
    }
}
