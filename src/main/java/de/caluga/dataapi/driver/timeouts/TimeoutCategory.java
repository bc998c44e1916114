package de.caluga.dataapi.driver.timeouts;

/**
 * named timeout budgets, the key is the name used in configuration and error messages
 */
public enum TimeoutCategory {
    REQUEST("requestTimeoutMs", 10000),
    GENERAL_METHOD("generalMethodTimeoutMs", 30000),
    COLLECTION_ADMIN("collectionAdminTimeoutMs", 60000),
    TABLE_ADMIN("tableAdminTimeoutMs", 30000),
    DATABASE_ADMIN("databaseAdminTimeoutMs", 600000),
    KEYSPACE_ADMIN("keyspaceAdminTimeoutMs", 30000);

    private final String key;
    private final long defaultMs;

    TimeoutCategory(String key, long defaultMs) {
        this.key = key;
        this.defaultMs = defaultMs;
    }

    public String getKey() {
        return key;
    }

    public long getDefaultMs() {
        return defaultMs;
    }

    public static TimeoutCategory fromKey(String key) {
        for (TimeoutCategory c : values()) {
            if (c.key.equals(key)) return c;
        }

        throw new IllegalArgumentException("Unknown timeout category: " + key);
    }

    @Override
    public String toString() {
        return key;
    }
}
