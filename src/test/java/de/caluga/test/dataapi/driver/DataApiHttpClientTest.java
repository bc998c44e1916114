package de.caluga.test.dataapi.driver;

import de.caluga.dataapi.driver.CollectionNotFoundException;
import de.caluga.dataapi.driver.DataApiAuthenticationException;
import de.caluga.dataapi.driver.DataApiHttpException;
import de.caluga.dataapi.driver.DataApiResponseException;
import de.caluga.dataapi.driver.DataApiTimeoutException;
import de.caluga.dataapi.driver.Doc;
import de.caluga.dataapi.driver.ObjectId;
import de.caluga.dataapi.driver.commands.FindCommand;
import de.caluga.dataapi.driver.http.DataApiHttpClient;
import de.caluga.dataapi.driver.http.DataApiResponse;
import de.caluga.dataapi.driver.http.FetcherRequest;
import de.caluga.dataapi.driver.timeouts.TimeoutCategory;
import de.caluga.dataapi.driver.timeouts.TimeoutManager;
import de.caluga.dataapi.driver.timeouts.TimeoutOverride;
import de.caluga.dataapi.events.CommandFailedEvent;
import de.caluga.dataapi.events.CommandWarningsEvent;
import de.caluga.dataapi.events.DataApiEvent;
import de.caluga.dataapi.events.DataApiEventType;
import de.caluga.dataapi.events.HierarchicalEmitter;
import de.caluga.test.dataapi.support.ManualTimeSource;
import de.caluga.test.dataapi.support.MockFetcher;
import de.caluga.test.dataapi.support.TestClients;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("inmemory")
public class DataApiHttpClientTest {
    private MockFetcher fetcher;
    private ManualTimeSource time;
    private HierarchicalEmitter emitter;
    private DataApiHttpClient client;
    private List<DataApiEvent> events;

    @BeforeEach
    public void setup() {
        fetcher = new MockFetcher();
        time = new ManualTimeSource();
        emitter = new HierarchicalEmitter(null);
        client = TestClients.dataApiClient(fetcher, time, emitter);
        events = new CopyOnWriteArrayList<>();

        for (DataApiEventType t : DataApiEventType.values()) {
            emitter.on(t, events::add);
        }
    }

    private TimeoutManager tm() {
        return client.timeouts().single(TimeoutCategory.GENERAL_METHOD, null);
    }

    @Test
    public void sendsCommandToCollectionUrl() {
        fetcher.enqueue(Doc.of("data", Doc.of("documents", List.of(Doc.of("_id", 1)), "nextPageState", null)));
        FindCommand cmd = new FindCommand().setFilter(Doc.of("age", Doc.of("$gt", 10))).setLimit(5).setCollection("users");

        DataApiResponse resp = client.execute(cmd, tm());

        FetcherRequest req = fetcher.lastRequest();
        assertThat(req.getUrl()).isEqualTo(TestClients.BASE_URL + "/default_keyspace/users");
        assertThat(req.getMethod()).isEqualTo("POST");
        assertThat(req.getHeaders()).containsEntry("Token", TestClients.TOKEN).containsEntry("Content-Type", "application/json");
        assertThat(req.getTimeoutMs()).isEqualTo(10000);
        assertThat(fetcher.body(0)).isEqualTo(Map.of("find", Map.of("filter", Map.of("age", Map.of("$gt", 10)), "options", Map.of("limit", 5))));
        assertThat(resp.getDocuments()).hasSize(1);
        assertThat(resp.getNextPageState()).isNull();

        assertThat(events).extracting(DataApiEvent::getType).containsExactly(DataApiEventType.COMMAND_STARTED, DataApiEventType.COMMAND_SUCCEEDED);
        assertThat(events.get(0).getRequestId()).isEqualTo(events.get(1).getRequestId());
    }

    @Test
    public void keyspaceCommandsOmitCollection() {
        fetcher.enqueue(Doc.of("status", Doc.of("collections", List.of("a", "b"))));
        client.executeCommand(Doc.of("findCollections", new Doc()), "other", null, tm());
        assertThat(fetcher.lastRequest().getUrl()).isEqualTo(TestClients.BASE_URL + "/other");

        fetcher.enqueue(Doc.of("status", Doc.of("keyspaces", List.of("a"))));
        client.executeGlobalCommand(Doc.of("findKeyspaces", new Doc()), tm());
        assertThat(fetcher.lastRequest().getUrl()).isEqualTo(TestClients.BASE_URL);
    }

    @Test
    public void wrappedValuesAreRevivedAndWritten() {
        String hex = "65f1a2b3c4d5e6f708192a3b";
        fetcher.enqueue(Doc.of("data", Doc.of("document", Doc.of("_id", Doc.of("$objectId", hex), "at", Doc.of("$date", 1700000000000L)))));
        DataApiResponse resp = client.executeCommand(Doc.of("findOne", Doc.of("filter", Doc.of("at", Instant.ofEpochMilli(5)))), null, "c", tm());

        assertThat(resp.getDocument().get("_id")).isEqualTo(new ObjectId(hex));
        assertThat(resp.getDocument().get("at")).isEqualTo(Instant.ofEpochMilli(1700000000000L));
        assertThat(fetcher.lastRequest().getBody()).contains("{\"$date\":5}");
    }

    @Test
    public void unauthorizedIsAuthenticationError() {
        fetcher.enqueue(401, "Unauthorized");

        assertThatThrownBy(() -> client.executeCommand(Doc.of("findOne", new Doc()), null, "c", tm()))
            .isInstanceOf(DataApiAuthenticationException.class)
            .hasMessage("Authentication failed; is your token valid?");

        assertThat(events).extracting(DataApiEvent::getType).containsExactly(DataApiEventType.COMMAND_STARTED, DataApiEventType.COMMAND_FAILED);
        assertThat(((CommandFailedEvent) events.get(1)).getError()).isInstanceOf(DataApiAuthenticationException.class);
    }

    @Test
    public void invalidTokenMessageIsAuthenticationError() {
        fetcher.enqueue(Doc.of("errors", List.of(Doc.of("message", "UNAUTHENTICATED: Invalid token"))));

        assertThatThrownBy(() -> client.executeCommand(Doc.of("findOne", new Doc()), null, "c", tm()))
            .isInstanceOf(DataApiAuthenticationException.class);
    }

    @Test
    public void missingCollectionIsParsedFromMessage() {
        fetcher.enqueue(Doc.of("errors", List.of(Doc.of("errorCode", "COLLECTION_NOT_EXIST", "message", "Collection does not exist, collection name: people"))));

        assertThatThrownBy(() -> client.executeCommand(Doc.of("findOne", new Doc()), "ks1", "people", tm()))
            .isInstanceOfSatisfying(CollectionNotFoundException.class, e -> {
                assertThat(e.getCollectionName()).isEqualTo("people");
                assertThat(e.getKeyspace()).isEqualTo("ks1");
                assertThat(e.getMessage()).isEqualTo("Collection 'ks1.people' not found");
            });
    }

    @Test
    public void httpErrorsAreNotParsed() {
        fetcher.enqueue(500, "Internal Server Error");

        assertThatThrownBy(() -> client.executeCommand(Doc.of("findOne", new Doc()), null, "c", tm()))
            .isInstanceOfSatisfying(DataApiHttpException.class, e -> {
                assertThat(e.getStatus()).isEqualTo(500);
                assertThat(e.getBody()).isEqualTo("Internal Server Error");
                assertThat(e.getCollection()).isEqualTo("c");
                assertThat(e.getCommand()).containsKey("findOne");
            });
    }

    @Test
    public void errorsInBodyFailEvenWithStatus200() {
        Map<String, Object> raw = Doc.of("errors", List.of(Doc.of("errorCode", "INVALID_FILTER", "message", "bad filter"), Doc.of("errorCode", "OTHER", "message", "second")));
        fetcher.enqueue(raw);

        assertThatThrownBy(() -> client.executeCommand(Doc.of("find", new Doc()), null, "c", tm()))
            .isInstanceOfSatisfying(DataApiResponseException.class, e -> {
                assertThat(e.getMessage()).isEqualTo("bad filter");
                assertThat(e.getErrorDescriptors()).hasSize(2);
                assertThat(e.getErrorDescriptors().get(0).getErrorCode()).isEqualTo("INVALID_FILTER");
                assertThat(e.getDetailedErrorDescriptors()).hasSize(1);
                assertThat(e.getDetailedErrorDescriptors().get(0).getCommand()).containsKey("find");
                assertThat(e.getRawResponse()).containsKey("errors");
            });
    }

    @Test
    public void warningsAreEmitted() {
        fetcher.enqueue(Doc.of("status", Doc.of("warnings", List.of(Doc.of("errorCode", "ZERO_FILTER_OPERATIONS", "message", "full scan")))));
        client.executeCommand(Doc.of("find", new Doc()), null, "c", tm());

        assertThat(events).extracting(DataApiEvent::getType)
            .containsExactly(DataApiEventType.COMMAND_STARTED, DataApiEventType.COMMAND_WARNINGS, DataApiEventType.COMMAND_SUCCEEDED);
        CommandWarningsEvent w = (CommandWarningsEvent) events.get(1);
        assertThat(w.getWarnings()).hasSize(1);
        assertThat(w.getWarnings().get(0).getMessage()).isEqualTo("full scan");
    }

    @Test
    public void expiredBudgetFailsWithoutRequest() {
        TimeoutManager tm = client.timeouts().multipart(TimeoutCategory.GENERAL_METHOD, TimeoutOverride.ofMillis(1000));
        fetcher.enqueue(Doc.of("status", Doc.of("deletedCount", 1, "moreData", true)));
        client.executeCommand(Doc.of("deleteMany", new Doc()), null, "c", tm);
        time.advance(1500);

        assertThatThrownBy(() -> client.executeCommand(Doc.of("deleteMany", new Doc()), null, "c", tm))
            .isInstanceOf(DataApiTimeoutException.class)
            .hasMessage("Command timed out after 1000ms (generalMethodTimeoutMs timed out)");
        assertThat(fetcher.requestCount()).isEqualTo(1);
        assertThat(events.get(events.size() - 1).getType()).isEqualTo(DataApiEventType.COMMAND_FAILED);
    }

    @Test
    public void transportTimeoutUsesTimeoutError() {
        fetcher.handler(req -> {
            throw req.mkTimeoutError();
        });

        assertThatThrownBy(() -> client.executeCommand(Doc.of("find", new Doc()), null, "c", tm()))
            .isInstanceOf(DataApiTimeoutException.class)
            .hasMessageContaining("requestTimeoutMs timed out");
    }
}
