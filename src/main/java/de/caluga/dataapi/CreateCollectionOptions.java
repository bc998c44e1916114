package de.caluga.dataapi;

import de.caluga.dataapi.driver.timeouts.TimeoutOverride;

import java.util.Map;

public class CreateCollectionOptions {
    private Map<String, Object> vector;
    private Map<String, Object> indexing;
    private Map<String, Object> defaultId;
    private TimeoutOverride timeout;

    /**
     * e.g. <code>{dimension: 1024, metric: "cosine"}</code>
     */
    public Map<String, Object> getVector() {
        return vector;
    }

    public CreateCollectionOptions setVector(Map<String, Object> vector) {
        this.vector = vector;
        return this;
    }

    public Map<String, Object> getIndexing() {
        return indexing;
    }

    public CreateCollectionOptions setIndexing(Map<String, Object> indexing) {
        this.indexing = indexing;
        return this;
    }

    public Map<String, Object> getDefaultId() {
        return defaultId;
    }

    public CreateCollectionOptions setDefaultId(Map<String, Object> defaultId) {
        this.defaultId = defaultId;
        return this;
    }

    public TimeoutOverride getTimeout() {
        return timeout;
    }

    public CreateCollectionOptions setTimeout(TimeoutOverride timeout) {
        this.timeout = timeout;
        return this;
    }
}
