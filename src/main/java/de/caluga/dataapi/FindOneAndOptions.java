package de.caluga.dataapi;

import de.caluga.dataapi.driver.timeouts.TimeoutOverride;

import java.util.Map;

/**
 * options of the <code>findOneAnd*</code> operations. <code>returnDocument</code> and <code>upsert</code>
 * are ignored by <code>findOneAndDelete</code>.
 */
public class FindOneAndOptions {
    private ReturnDocument returnDocument = ReturnDocument.BEFORE;
    private boolean upsert;
    private Map<String, Object> sort;
    private Map<String, Object> projection;
    private boolean includeResultMetadata;
    private TimeoutOverride timeout;

    public ReturnDocument getReturnDocument() {
        return returnDocument;
    }

    public FindOneAndOptions setReturnDocument(ReturnDocument returnDocument) {
        this.returnDocument = returnDocument;
        return this;
    }

    public boolean isUpsert() {
        return upsert;
    }

    public FindOneAndOptions setUpsert(boolean upsert) {
        this.upsert = upsert;
        return this;
    }

    public Map<String, Object> getSort() {
        return sort;
    }

    public FindOneAndOptions setSort(Map<String, Object> sort) {
        this.sort = sort;
        return this;
    }

    public Map<String, Object> getProjection() {
        return projection;
    }

    public FindOneAndOptions setProjection(Map<String, Object> projection) {
        this.projection = projection;
        return this;
    }

    public boolean isIncludeResultMetadata() {
        return includeResultMetadata;
    }

    /**
     * true: the result is <code>{value: document, ok: 1}</code> instead of the document itself
     */
    public FindOneAndOptions setIncludeResultMetadata(boolean includeResultMetadata) {
        this.includeResultMetadata = includeResultMetadata;
        return this;
    }

    public TimeoutOverride getTimeout() {
        return timeout;
    }

    public FindOneAndOptions setTimeout(TimeoutOverride timeout) {
        this.timeout = timeout;
        return this;
    }
}
