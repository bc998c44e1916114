package de.caluga.test.dataapi.support;

import de.caluga.dataapi.config.ConnectionSettings;
import de.caluga.dataapi.config.LoggingSettings;
import de.caluga.dataapi.driver.DataApiTimeoutException;
import de.caluga.dataapi.driver.http.DataApiHttpClient;
import de.caluga.dataapi.driver.serdes.DataApiJson;
import de.caluga.dataapi.driver.timeouts.TimeoutDescriptor;
import de.caluga.dataapi.driver.timeouts.Timeouts;
import de.caluga.dataapi.events.EventLogger;
import de.caluga.dataapi.events.HierarchicalEmitter;

public final class TestClients {
    public static final String ENDPOINT = "http://localhost:8181";
    public static final String BASE_URL = ENDPOINT + "/api/json/v1";
    public static final String TOKEN = "AstraCS:test";

    private TestClients() {
    }

    public static DataApiHttpClient dataApiClient(MockFetcher fetcher, ManualTimeSource ts, HierarchicalEmitter emitter) {
        ConnectionSettings cs = new ConnectionSettings().setEndpoint(ENDPOINT).setToken(TOKEN);
        Timeouts timeouts = new Timeouts(DataApiTimeoutException::new, TimeoutDescriptor.defaults(), ts);
        return new DataApiHttpClient(cs, fetcher, new EventLogger(emitter, new LoggingSettings()), timeouts, new DataApiJson());
    }
}
