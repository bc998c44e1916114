package de.caluga.test.dataapi.admin;

import de.caluga.dataapi.DataApiClient;
import de.caluga.dataapi.admin.DbAdmin;
import de.caluga.dataapi.config.DataApiConfig;
import de.caluga.dataapi.driver.Doc;
import de.caluga.test.dataapi.support.ManualTimeSource;
import de.caluga.test.dataapi.support.MockFetcher;
import de.caluga.test.dataapi.support.TestClients;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("inmemory")
public class DbAdminTest {
    private MockFetcher fetcher;
    private DbAdmin admin;

    @BeforeEach
    public void setup() {
        fetcher = new MockFetcher();
        DataApiConfig cfg = new DataApiConfig();
        cfg.connectionSettings().setToken(TestClients.TOKEN);
        admin = new DataApiClient(cfg, fetcher, new ManualTimeSource(), null).db(TestClients.ENDPOINT, "ks1").admin();
    }

    @Test
    public void listKeyspaces() {
        fetcher.enqueue(Doc.of("status", Doc.of("keyspaces", List.of("default_keyspace", "ks1"))));

        assertThat(admin.listKeyspaces()).containsExactly("default_keyspace", "ks1");
        assertThat(fetcher.lastRequest().getUrl()).isEqualTo(TestClients.BASE_URL);
        assertThat(fetcher.body(0)).isEqualTo(Map.of("findKeyspaces", Map.of()));
        assertThat(admin.getDb().getKeyspace()).isEqualTo("ks1");
    }

    @Test
    public void createAndDrop() {
        fetcher.enqueue(Doc.of("status", Doc.of("ok", 1)));
        fetcher.enqueue(Doc.of("status", Doc.of("ok", 1)));

        admin.createKeyspace("ks2");
        admin.dropKeyspace("ks2");

        assertThat(fetcher.body(0)).isEqualTo(Map.of("createKeyspace", Map.of("name", "ks2")));
        assertThat(fetcher.body(1)).isEqualTo(Map.of("dropKeyspace", Map.of("name", "ks2")));
        assertThat(fetcher.getRequests()).allMatch(r -> r.getUrl().equals(TestClients.BASE_URL));
    }
}
