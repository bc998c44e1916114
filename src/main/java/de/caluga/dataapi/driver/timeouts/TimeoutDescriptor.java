package de.caluga.dataapi.driver.timeouts;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * milliseconds per {@link TimeoutCategory}. May be partial when used as an override,
 * {@link #merge(TimeoutDescriptor, TimeoutDescriptor)} always returns a complete one.
 * A value of 0 means "no limit".
 */
public class TimeoutDescriptor {
    private final EnumMap<TimeoutCategory, Long> values = new EnumMap<>(TimeoutCategory.class);

    public static TimeoutDescriptor defaults() {
        TimeoutDescriptor ret = new TimeoutDescriptor();

        for (TimeoutCategory c : TimeoutCategory.values()) {
            ret.set(c, c.getDefaultMs());
        }

        return ret;
    }

    public static TimeoutDescriptor partial() {
        return new TimeoutDescriptor();
    }

    /**
     * @return base itself if override is null, otherwise a new descriptor with every key of override applied on top of base
     */
    public static TimeoutDescriptor merge(TimeoutDescriptor base, TimeoutDescriptor override) {
        if (override == null) return base;
        TimeoutDescriptor ret = new TimeoutDescriptor();

        for (TimeoutCategory c : TimeoutCategory.values()) {
            Long v = override.values.containsKey(c) ? override.values.get(c) : base.values.get(c);
            ret.values.put(c, v == null ? c.getDefaultMs() : v);
        }

        return ret;
    }

    public TimeoutDescriptor set(TimeoutCategory c, long ms) {
        if (ms < 0) throw new IllegalArgumentException("timeout for " + c + " must not be negative: " + ms);
        values.put(c, ms);
        return this;
    }

    public Long get(TimeoutCategory c) {
        return values.get(c);
    }

    public boolean has(TimeoutCategory c) {
        return values.containsKey(c);
    }

    public boolean isComplete() {
        return values.size() == TimeoutCategory.values().length;
    }

    public TimeoutDescriptor setRequestTimeoutMs(long ms) {
        return set(TimeoutCategory.REQUEST, ms);
    }

    public TimeoutDescriptor setGeneralMethodTimeoutMs(long ms) {
        return set(TimeoutCategory.GENERAL_METHOD, ms);
    }

    public TimeoutDescriptor setCollectionAdminTimeoutMs(long ms) {
        return set(TimeoutCategory.COLLECTION_ADMIN, ms);
    }

    public TimeoutDescriptor setTableAdminTimeoutMs(long ms) {
        return set(TimeoutCategory.TABLE_ADMIN, ms);
    }

    public TimeoutDescriptor setDatabaseAdminTimeoutMs(long ms) {
        return set(TimeoutCategory.DATABASE_ADMIN, ms);
    }

    public TimeoutDescriptor setKeyspaceAdminTimeoutMs(long ms) {
        return set(TimeoutCategory.KEYSPACE_ADMIN, ms);
    }

    /**
     * key name to ms, only the categories present
     */
    public Map<String, Object> asMap() {
        Map<String, Object> ret = new LinkedHashMap<>();

        for (Map.Entry<TimeoutCategory, Long> e : values.entrySet()) {
            ret.put(e.getKey().getKey(), e.getValue());
        }

        return ret;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((TimeoutDescriptor) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
