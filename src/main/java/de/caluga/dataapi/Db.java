package de.caluga.dataapi;

import de.caluga.dataapi.admin.DbAdmin;
import de.caluga.dataapi.driver.Doc;
import de.caluga.dataapi.driver.commands.CreateCollectionCommand;
import de.caluga.dataapi.driver.commands.DeleteCollectionCommand;
import de.caluga.dataapi.driver.commands.FindCollectionsCommand;
import de.caluga.dataapi.driver.http.DataApiHttpClient;
import de.caluga.dataapi.driver.http.DataApiResponse;
import de.caluga.dataapi.driver.timeouts.TimeoutCategory;
import de.caluga.dataapi.driver.timeouts.TimeoutOverride;
import de.caluga.dataapi.events.DataApiEventListener;
import de.caluga.dataapi.events.DataApiEventType;
import de.caluga.dataapi.events.EventLogger;
import de.caluga.dataapi.events.HierarchicalEmitter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * one Data API endpoint with its working keyspace
 */
public class Db {
    private final DataApiClient client;
    private final String keyspace;
    private final DataApiHttpClient httpClient;
    private final HierarchicalEmitter emitter;

    Db(DataApiClient client, String keyspace, DataApiHttpClient httpClient, HierarchicalEmitter emitter) {
        this.client = client;
        this.keyspace = keyspace;
        this.httpClient = httpClient;
        this.emitter = emitter;
    }

    public DataApiClient getClient() {
        return client;
    }

    public String getKeyspace() {
        return keyspace;
    }

    public HierarchicalEmitter getEmitter() {
        return emitter;
    }

    public DataApiHttpClient getHttpClient() {
        return httpClient;
    }

    public DataApiEventListener on(DataApiEventType type, DataApiEventListener listener) {
        return emitter.on(type, listener);
    }

    public void off(DataApiEventType type, DataApiEventListener listener) {
        emitter.off(type, listener);
    }

    /**
     * handle on a collection, nothing is sent to the server
     */
    public Collection collection(String name) {
        return collection(name, keyspace);
    }

    public Collection collection(String name, String keyspace) {
        HierarchicalEmitter collEmitter = new HierarchicalEmitter(emitter);
        EventLogger logger = httpClient.getEventLogger().forChild(collEmitter, null);
        return new Collection(this, keyspace == null ? this.keyspace : keyspace, name, httpClient.withEventLogger(logger), collEmitter);
    }

    public Collection createCollection(String name) {
        return createCollection(name, null);
    }

    public Collection createCollection(String name, CreateCollectionOptions options) {
        if (options == null) options = new CreateCollectionOptions();
        CreateCollectionCommand cmd = new CreateCollectionCommand()
                .setName(name)
                .setVector(options.getVector())
                .setIndexing(options.getIndexing())
                .setDefaultId(options.getDefaultId())
                .setKeyspace(keyspace);
        httpClient.execute(cmd, httpClient.timeouts().single(TimeoutCategory.COLLECTION_ADMIN, options.getTimeout()));
        return collection(name);
    }

    public void dropCollection(String name) {
        dropCollection(name, null);
    }

    public void dropCollection(String name, TimeoutOverride timeout) {
        DeleteCollectionCommand cmd = new DeleteCollectionCommand().setName(name).setKeyspace(keyspace);
        httpClient.execute(cmd, httpClient.timeouts().single(TimeoutCategory.COLLECTION_ADMIN, timeout));
    }

    /**
     * @param nameOnly true: just the names, false: <code>{name, options}</code> maps
     * @return collection names (String) or descriptions (Map)
     */
    public List<Object> listCollections(boolean nameOnly) {
        return listCollections(nameOnly, null);
    }

    public List<Object> listCollections(boolean nameOnly, TimeoutOverride timeout) {
        FindCollectionsCommand cmd = new FindCollectionsCommand().setKeyspace(keyspace);
        if (!nameOnly) cmd.setExplain(true);
        DataApiResponse resp = httpClient.execute(cmd, httpClient.timeouts().single(TimeoutCategory.COLLECTION_ADMIN, timeout));
        List<Object> collections = resp.getStatus().getList("collections");
        return collections == null ? new ArrayList<>() : collections;
    }

    /**
     * sends a raw command, to the keyspace of this db if <code>keyspace</code> is null
     *
     * @param collection null for a keyspace level command
     */
    public Map<String, Object> command(Map<String, Object> command, String keyspace, String collection) {
        return command(command, keyspace, collection, null);
    }

    public Map<String, Object> command(Map<String, Object> command, String keyspace, String collection, TimeoutOverride timeout) {
        DataApiResponse resp = httpClient.executeCommand(command, keyspace == null ? this.keyspace : keyspace, collection,
                httpClient.timeouts().single(TimeoutCategory.GENERAL_METHOD, timeout));
        return Doc.of(resp.getRaw());
    }

    /**
     * keyspace administration through the Data API
     */
    public DbAdmin admin() {
        return new DbAdmin(this, httpClient);
    }

    @Override
    public String toString() {
        return "Db{" + httpClient.getBaseUrl() + ", keyspace=" + keyspace + "}";
    }
}
