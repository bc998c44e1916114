package de.caluga.dataapi.query;

import de.caluga.dataapi.driver.timeouts.TimeoutOverride;

import java.util.Map;

/**
 * options of <code>find</code>, applied to the returned cursor before it is started
 */
public class FindOptions {
    private Map<String, Object> sort;
    private Map<String, Object> projection;
    private int limit;
    private Integer skip;
    private int batchSize;
    private boolean includeSimilarity;
    private TimeoutOverride timeout;

    public Map<String, Object> getSort() {
        return sort;
    }

    public FindOptions setSort(Map<String, Object> sort) {
        this.sort = sort;
        return this;
    }

    public Map<String, Object> getProjection() {
        return projection;
    }

    public FindOptions setProjection(Map<String, Object> projection) {
        this.projection = projection;
        return this;
    }

    public int getLimit() {
        return limit;
    }

    public FindOptions setLimit(int limit) {
        this.limit = limit;
        return this;
    }

    public Integer getSkip() {
        return skip;
    }

    public FindOptions setSkip(Integer skip) {
        this.skip = skip;
        return this;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public FindOptions setBatchSize(int batchSize) {
        this.batchSize = batchSize;
        return this;
    }

    public boolean isIncludeSimilarity() {
        return includeSimilarity;
    }

    public FindOptions setIncludeSimilarity(boolean includeSimilarity) {
        this.includeSimilarity = includeSimilarity;
        return this;
    }

    /**
     * applies to each page fetch
     */
    public TimeoutOverride getTimeout() {
        return timeout;
    }

    public FindOptions setTimeout(TimeoutOverride timeout) {
        this.timeout = timeout;
        return this;
    }
}
