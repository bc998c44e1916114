package de.caluga.dataapi;

import de.caluga.dataapi.driver.Doc;

import java.util.Map;

/**
 * counts reported by <code>updateOne</code>, <code>updateMany</code> and <code>replaceOne</code>
 */
public class UpdateResult {
    private long matchedCount;
    private long modifiedCount;
    private long upsertedCount;
    private Object upsertedId;

    public UpdateResult() {
    }

    public UpdateResult(long matchedCount, long modifiedCount, long upsertedCount, Object upsertedId) {
        this.matchedCount = matchedCount;
        this.modifiedCount = modifiedCount;
        this.upsertedCount = upsertedCount;
        this.upsertedId = upsertedId;
    }

    /**
     * reads <code>status.matchedCount</code>, <code>status.modifiedCount</code> and <code>status.upsertedId</code>
     */
    public static UpdateResult fromStatus(Map<String, Object> status) {
        Doc s = Doc.of(status);
        Object upserted = s.get("upsertedId");
        return new UpdateResult(s.getLong("matchedCount", 0), s.getLong("modifiedCount", 0), upserted != null ? 1 : 0, upserted);
    }

    /**
     * adds the counts of one page of a paginated update
     */
    public UpdateResult add(UpdateResult other) {
        matchedCount += other.matchedCount;
        modifiedCount += other.modifiedCount;
        upsertedCount += other.upsertedCount;
        if (other.upsertedId != null) upsertedId = other.upsertedId;
        return this;
    }

    public long getMatchedCount() {
        return matchedCount;
    }

    public long getModifiedCount() {
        return modifiedCount;
    }

    public long getUpsertedCount() {
        return upsertedCount;
    }

    public Object getUpsertedId() {
        return upsertedId;
    }

    @Override
    public String toString() {
        return "UpdateResult{matched=" + matchedCount + ", modified=" + modifiedCount + ", upserted=" + upsertedCount + (upsertedId != null ? ", upsertedId=" + upsertedId : "") + "}";
    }
}
