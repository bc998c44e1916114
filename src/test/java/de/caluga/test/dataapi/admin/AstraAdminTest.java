package de.caluga.test.dataapi.admin;

import de.caluga.dataapi.DataApiClient;
import de.caluga.dataapi.admin.AdminBlockingOptions;
import de.caluga.dataapi.admin.AstraAdmin;
import de.caluga.dataapi.admin.AstraDbAdmin;
import de.caluga.dataapi.admin.ListDatabasesOptions;
import de.caluga.dataapi.config.DataApiConfig;
import de.caluga.dataapi.driver.DevOpsApiResponseException;
import de.caluga.dataapi.driver.DevOpsApiTimeoutException;
import de.caluga.dataapi.driver.DevOpsUnexpectedStateException;
import de.caluga.dataapi.driver.Doc;
import de.caluga.dataapi.driver.http.FetcherRequest;
import de.caluga.dataapi.driver.http.FetcherResponse;
import de.caluga.dataapi.events.AdminCommandPollingEvent;
import de.caluga.dataapi.events.DataApiEvent;
import de.caluga.dataapi.events.DataApiEventType;
import de.caluga.test.dataapi.support.ManualTimeSource;
import de.caluga.test.dataapi.support.MockFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("inmemory")
public class AstraAdminTest {
    private static final String DEVOPS = "http://devops.local/v2";
    private static final String DB_ID = "3f2a-db";

    private MockFetcher fetcher;
    private ManualTimeSource time;
    private AstraAdmin admin;
    private List<DataApiEvent> events;

    @BeforeEach
    public void setup() {
        fetcher = new MockFetcher();
        time = new ManualTimeSource();
        DataApiConfig cfg = new DataApiConfig();
        cfg.connectionSettings().setToken("AstraCS:app");
        cfg.adminSettings().setDevOpsEndpoint(DEVOPS + "/").setAdminToken("AstraCS:admin");
        DataApiClient client = new DataApiClient(cfg, fetcher, time, null);
        admin = client.admin();
        events = new ArrayList<>();

        for (DataApiEventType t : DataApiEventType.values()) {
            client.on(t, events::add);
        }
    }

    private static FetcherResponse created() {
        return new FetcherResponse(201, "", Map.of("location", DEVOPS + "/databases/" + DB_ID), "HTTP/1.1");
    }

    private void enqueueStatus(String... states) {
        for (String s : states) {
            fetcher.enqueue(Doc.of("id", DB_ID, "status", s, "info", Doc.of("name", "vectors")));
        }
    }

    private static Map<String, Object> dbConfig() {
        return Doc.of("name", "vectors", "cloudProvider", "GCP", "region", "us-east1");
    }

    private List<DataApiEventType> eventTypes() {
        List<DataApiEventType> ret = new ArrayList<>();

        for (DataApiEvent e : events) {
            ret.add(e.getType());
        }

        return ret;
    }

    @Test
    public void createDatabaseWaitsForActive() {
        fetcher.enqueue(created());
        enqueueStatus("INITIALIZING", "INITIALIZING", "ACTIVE");

        AstraDbAdmin dbAdmin = admin.createDatabase(dbConfig(), null);

        assertThat(dbAdmin.getId()).isEqualTo(DB_ID);
        assertThat(fetcher.requestCount()).isEqualTo(4);
        assertThat(time.getSleeps()).containsExactly(10000L, 10000L);

        FetcherRequest post = fetcher.getRequests().get(0);
        assertThat(post.getMethod()).isEqualTo("POST");
        assertThat(post.getUrl()).isEqualTo(DEVOPS + "/databases");
        assertThat(post.getHeaders()).containsEntry("Authorization", "Bearer AstraCS:admin");
        assertThat(post.isForceHttp1()).isTrue();
        assertThat(fetcher.body(0)).containsEntry("name", "vectors")
            .containsEntry("capacityUnits", 1)
            .containsEntry("tier", "serverless")
            .containsEntry("dbType", "vector");

        for (int i = 1; i < 4; i++) {
            assertThat(fetcher.getRequests().get(i).getUrl()).isEqualTo(DEVOPS + "/databases/" + DB_ID);
            assertThat(fetcher.getRequests().get(i).getMethod()).isEqualTo("GET");
        }

        assertThat(eventTypes()).containsExactly(DataApiEventType.ADMIN_COMMAND_STARTED, DataApiEventType.ADMIN_COMMAND_POLLING,
                DataApiEventType.ADMIN_COMMAND_POLLING, DataApiEventType.ADMIN_COMMAND_SUCCEEDED);
        AdminCommandPollingEvent second = (AdminCommandPollingEvent) events.get(2);
        assertThat(second.getInterval()).isEqualTo(10000);
        assertThat(second.getElapsed()).isEqualTo(10000);
    }

    @Test
    public void nonBlockingReturnsAfterFirstRequest() {
        fetcher.enqueue(created());

        AstraDbAdmin dbAdmin = admin.createDatabase(dbConfig(), AdminBlockingOptions.nonBlocking());

        assertThat(dbAdmin.getId()).isEqualTo(DB_ID);
        assertThat(fetcher.requestCount()).isEqualTo(1);
        assertThat(time.getSleeps()).isEmpty();
    }

    @Test
    public void customPollInterval() {
        fetcher.enqueue(created());
        enqueueStatus("PENDING", "ACTIVE");

        admin.createDatabase(dbConfig(), new AdminBlockingOptions().setPollIntervalMs(500));

        assertThat(time.getSleeps()).containsExactly(500L);
    }

    @Test
    public void unexpectedStateFails() {
        fetcher.enqueue(created());
        enqueueStatus("INITIALIZING", "ERROR");

        assertThatThrownBy(() -> admin.createDatabase(dbConfig(), null))
            .isInstanceOfSatisfying(DevOpsUnexpectedStateException.class, e -> {
                assertThat(e.getExpected()).containsExactly("ACTIVE", "INITIALIZING", "PENDING");
                assertThat(e.getDbInfo()).containsEntry("status", "ERROR");
                assertThat(e.getMessage()).contains("ERROR");
            });
        assertThat(eventTypes()).endsWith(DataApiEventType.ADMIN_COMMAND_FAILED);
    }

    @Test
    public void providedTimeoutCoversPolling() {
        fetcher.enqueue(created());
        enqueueStatus("INITIALIZING", "INITIALIZING", "INITIALIZING");

        assertThatThrownBy(() -> admin.createDatabase(dbConfig(), new AdminBlockingOptions().setTimeout(15000L)))
            .isInstanceOf(DevOpsApiTimeoutException.class)
            .hasMessage("Command timed out after 15000ms (The timeout provided via `{ timeout: <number> }` timed out)");
        assertThat(fetcher.requestCount()).isEqualTo(3);
    }

    @Test
    public void errorResponse() {
        fetcher.enqueue(400, Doc.of("errors", List.of(Doc.of("ID", 2000367, "message", "Invalid region"))));

        assertThatThrownBy(() -> admin.createDatabase(dbConfig(), null))
            .isInstanceOfSatisfying(DevOpsApiResponseException.class, e -> {
                assertThat(e.getStatus()).isEqualTo(400);
                assertThat(e.getMessage()).isEqualTo("Invalid region");
                assertThat(e.getErrors()).hasSize(1);
                assertThat(e.getErrors().get(0).getId()).isEqualTo(2000367);
            });
        assertThat(eventTypes()).containsExactly(DataApiEventType.ADMIN_COMMAND_STARTED, DataApiEventType.ADMIN_COMMAND_FAILED);
    }

    @Test
    public void missingLocationHeader() {
        fetcher.enqueue(201, "");

        assertThatThrownBy(() -> admin.createDatabase(dbConfig(), AdminBlockingOptions.nonBlocking()))
            .hasMessageContaining("Location");
    }

    @Test
    public void listDatabasesWithParams() {
        fetcher.enqueue(List.of(Doc.of("id", "a", "status", "ACTIVE"), Doc.of("id", "b", "status", "HIBERNATED")));

        List<Map<String, Object>> dbs = admin.listDatabases(new ListDatabasesOptions().setInclude("nonterminated").setProvider("GCP").setLimit(10).setSkip("a0"), null);

        assertThat(dbs).extracting(m -> m.get("id")).containsExactly("a", "b");
        assertThat(fetcher.lastRequest().getUrl()).isEqualTo(DEVOPS + "/databases?include=nonterminated&provider=GCP&limit=10&starting_after=a0");
        assertThat(fetcher.lastRequest().getMethod()).isEqualTo("GET");
        assertThat(eventTypes()).containsExactly(DataApiEventType.ADMIN_COMMAND_STARTED, DataApiEventType.ADMIN_COMMAND_SUCCEEDED);
    }

    @Test
    public void listDatabasesNeedsArray() {
        fetcher.enqueue(Doc.of("unexpected", true));
        assertThatThrownBy(() -> admin.listDatabases()).hasMessageContaining("Unexpected response");
    }

    @Test
    public void keyspaceLifecycle() {
        AstraDbAdmin dbAdmin = admin.dbAdmin(DB_ID);
        fetcher.enqueue(201, "");
        enqueueStatus("MAINTENANCE", "ACTIVE");

        dbAdmin.createKeyspace("ks2", null);

        assertThat(fetcher.getRequests().get(0).getMethod()).isEqualTo("POST");
        assertThat(fetcher.getRequests().get(0).getUrl()).isEqualTo(DEVOPS + "/databases/" + DB_ID + "/keyspaces/ks2");
        assertThat(time.getSleeps()).containsExactly(1000L);

        fetcher.enqueue(202, "");
        enqueueStatus("ACTIVE");
        dbAdmin.dropKeyspace("ks2", null);

        assertThat(fetcher.getRequests().get(3).getMethod()).isEqualTo("DELETE");
        assertThat(fetcher.requestCount()).isEqualTo(5);
    }

    @Test
    public void keyspacesFromInfo() {
        fetcher.enqueue(Doc.of("id", DB_ID, "info", Doc.of("keyspaces", List.of("default_keyspace", "ks2"))));
        assertThat(admin.dbAdmin(DB_ID).listKeyspaces()).containsExactly("default_keyspace", "ks2");
    }

    @Test
    public void dropDatabase() {
        fetcher.enqueue(202, "");
        enqueueStatus("TERMINATING", "TERMINATED");

        admin.dbAdmin(DB_ID).drop(null);

        assertThat(fetcher.getRequests().get(0).getUrl()).isEqualTo(DEVOPS + "/databases/" + DB_ID + "/terminate");
        assertThat(fetcher.requestCount()).isEqualTo(3);
    }
}
