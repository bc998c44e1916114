package de.caluga.dataapi.bulk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class InsertManyResult {
    private final List<Object> insertedIds;

    public InsertManyResult(List<Object> insertedIds) {
        this.insertedIds = Collections.unmodifiableList(new ArrayList<>(insertedIds));
    }

    public int getInsertedCount() {
        return insertedIds.size();
    }

    /**
     * in insertion order for ordered inserts, unordered otherwise
     */
    public List<Object> getInsertedIds() {
        return insertedIds;
    }

    @Override
    public String toString() {
        return "InsertManyResult{insertedCount=" + getInsertedCount() + "}";
    }
}
