package de.caluga.dataapi.driver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * insertion ordered JSON object as it goes over the wire
 */
public class Doc extends LinkedHashMap<String, Object> {

    public Doc() {
    }

    public Doc(Map<? extends String, ?> m) {
        super();
        if (m != null) {
            putAll(m);
        }
    }

    public static Doc of() {
        return new Doc();
    }

    public static Doc of(String k1, Object v1) {
        return of().add(k1, v1);
    }

    public static Doc of(String k1, Object v1, String k2, Object v2) {
        return of().add(k1, v1).add(k2, v2);
    }

    public static Doc of(String k1, Object v1, String k2, Object v2, String k3, Object v3) {
        return of().add(k1, v1).add(k2, v2).add(k3, v3);
    }

    public static Doc of(String k1, Object v1, String k2, Object v2, String k3, Object v3, String k4, Object v4) {
        return of().add(k1, v1).add(k2, v2).add(k3, v3).add(k4, v4);
    }

    public static Doc of(Map<String, Object> map) {
        if (map == null) return new Doc();
        if (map instanceof Doc) return (Doc) map;
        return new Doc(map);
    }

    public static List<Map<String, Object>> convertToMapList(List<?> lst) {
        var ret = new ArrayList<Map<String, Object>>();
        if (lst == null) return ret;

        for (Object o : lst) {
            ret.add(asMap(o));
        }

        return ret;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object o) {
        if (o instanceof Map) return (Map<String, Object>) o;
        return null;
    }

    public Doc add(String k, Object value) {
        put(k, value);
        return this;
    }

    public Doc addIfNotNull(String k, Object value) {
        if (value != null) put(k, value);
        return this;
    }

    public Doc getDoc(String k) {
        Map<String, Object> m = asMap(get(k));
        return m == null ? null : of(m);
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(String k) {
        Object o = get(k);
        if (o instanceof List) return (List<Object>) o;
        return null;
    }

    public String getString(String k) {
        Object o = get(k);
        return o == null ? null : o.toString();
    }

    public long getLong(String k, long def) {
        Object o = get(k);
        if (o instanceof Number) return ((Number) o).longValue();
        return def;
    }

    public boolean getBoolean(String k) {
        return Boolean.TRUE.equals(get(k));
    }
}
