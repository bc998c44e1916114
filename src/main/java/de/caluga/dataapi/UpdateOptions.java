package de.caluga.dataapi;

import de.caluga.dataapi.driver.timeouts.TimeoutOverride;

import java.util.Map;

/**
 * options of <code>updateOne</code>, <code>updateMany</code> and <code>replaceOne</code>.
 * Sort is ignored by <code>updateMany</code>.
 */
public class UpdateOptions {
    private boolean upsert;
    private Map<String, Object> sort;
    private TimeoutOverride timeout;

    public boolean isUpsert() {
        return upsert;
    }

    public UpdateOptions setUpsert(boolean upsert) {
        this.upsert = upsert;
        return this;
    }

    public Map<String, Object> getSort() {
        return sort;
    }

    public UpdateOptions setSort(Map<String, Object> sort) {
        this.sort = sort;
        return this;
    }

    public TimeoutOverride getTimeout() {
        return timeout;
    }

    public UpdateOptions setTimeout(TimeoutOverride timeout) {
        this.timeout = timeout;
        return this;
    }
}
