package de.caluga.dataapi.config;

import de.caluga.dataapi.driver.timeouts.TimeoutCategory;
import de.caluga.dataapi.driver.timeouts.TimeoutDescriptor;

/**
 * client wide default timeouts in ms, 0 means no limit
 */
public class TimeoutSettings extends Settings {
    private long requestTimeoutMs = TimeoutCategory.REQUEST.getDefaultMs();
    private long generalMethodTimeoutMs = TimeoutCategory.GENERAL_METHOD.getDefaultMs();
    private long collectionAdminTimeoutMs = TimeoutCategory.COLLECTION_ADMIN.getDefaultMs();
    private long tableAdminTimeoutMs = TimeoutCategory.TABLE_ADMIN.getDefaultMs();
    private long databaseAdminTimeoutMs = TimeoutCategory.DATABASE_ADMIN.getDefaultMs();
    private long keyspaceAdminTimeoutMs = TimeoutCategory.KEYSPACE_ADMIN.getDefaultMs();

    public TimeoutDescriptor toDescriptor() {
        return TimeoutDescriptor.partial()
                .setRequestTimeoutMs(requestTimeoutMs)
                .setGeneralMethodTimeoutMs(generalMethodTimeoutMs)
                .setCollectionAdminTimeoutMs(collectionAdminTimeoutMs)
                .setTableAdminTimeoutMs(tableAdminTimeoutMs)
                .setDatabaseAdminTimeoutMs(databaseAdminTimeoutMs)
                .setKeyspaceAdminTimeoutMs(keyspaceAdminTimeoutMs);
    }

    /**
     * applies every category present in the (partial) descriptor
     */
    public TimeoutSettings apply(TimeoutDescriptor d) {
        TimeoutDescriptor merged = TimeoutDescriptor.merge(toDescriptor(), d);
        requestTimeoutMs = merged.get(TimeoutCategory.REQUEST);
        generalMethodTimeoutMs = merged.get(TimeoutCategory.GENERAL_METHOD);
        collectionAdminTimeoutMs = merged.get(TimeoutCategory.COLLECTION_ADMIN);
        tableAdminTimeoutMs = merged.get(TimeoutCategory.TABLE_ADMIN);
        databaseAdminTimeoutMs = merged.get(TimeoutCategory.DATABASE_ADMIN);
        keyspaceAdminTimeoutMs = merged.get(TimeoutCategory.KEYSPACE_ADMIN);
        return this;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public TimeoutSettings setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
        return this;
    }

    public long getGeneralMethodTimeoutMs() {
        return generalMethodTimeoutMs;
    }

    public TimeoutSettings setGeneralMethodTimeoutMs(long generalMethodTimeoutMs) {
        this.generalMethodTimeoutMs = generalMethodTimeoutMs;
        return this;
    }

    public long getCollectionAdminTimeoutMs() {
        return collectionAdminTimeoutMs;
    }

    public TimeoutSettings setCollectionAdminTimeoutMs(long collectionAdminTimeoutMs) {
        this.collectionAdminTimeoutMs = collectionAdminTimeoutMs;
        return this;
    }

    public long getTableAdminTimeoutMs() {
        return tableAdminTimeoutMs;
    }

    public TimeoutSettings setTableAdminTimeoutMs(long tableAdminTimeoutMs) {
        this.tableAdminTimeoutMs = tableAdminTimeoutMs;
        return this;
    }

    public long getDatabaseAdminTimeoutMs() {
        return databaseAdminTimeoutMs;
    }

    public TimeoutSettings setDatabaseAdminTimeoutMs(long databaseAdminTimeoutMs) {
        this.databaseAdminTimeoutMs = databaseAdminTimeoutMs;
        return this;
    }

    public long getKeyspaceAdminTimeoutMs() {
        return keyspaceAdminTimeoutMs;
    }

    public TimeoutSettings setKeyspaceAdminTimeoutMs(long keyspaceAdminTimeoutMs) {
        this.keyspaceAdminTimeoutMs = keyspaceAdminTimeoutMs;
        return this;
    }
}
