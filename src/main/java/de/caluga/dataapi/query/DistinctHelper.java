package de.caluga.dataapi.query;

import de.caluga.dataapi.driver.Doc;
import de.caluga.dataapi.driver.serdes.DataApiJson;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * client side <code>distinct</code>: values at a dotted path, arrays are descended into one level,
 * duplicates are dropped keeping the first occurrence
 */
public class DistinctHelper {
    private final String key;
    private final List<String> path;
    private final DataApiJson json;

    public DistinctHelper(String key, DataApiJson json) {
        this.key = key;
        this.path = parsePath(key);
        this.json = json;
    }

    public static List<String> parsePath(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Path cannot contain empty segments");
        }

        List<String> ret = Arrays.asList(key.split("\\.", -1));

        for (String s : ret) {
            if (s.isEmpty()) throw new IllegalArgumentException("Path cannot contain empty segments");
        }

        return ret;
    }

    /**
     * the path up to its first numeric segment, array indexes cannot be projected
     */
    public String projectionPath() {
        List<String> ret = new ArrayList<>();

        for (String s : path) {
            if (isIndex(s)) break;
            ret.add(s);
        }

        return String.join(".", ret);
    }

    public Doc projection() {
        String p = projectionPath();
        if (p.equals("_id")) return Doc.of("_id", 1);
        return Doc.of("_id", 0, p, 1);
    }

    public String getKey() {
        return key;
    }

    public List<Object> distinct(FindCursor<Map<String, Object>> cursor) {
        Map<Object, Object> seen = new LinkedHashMap<>();
        cursor.forEach(doc -> {
            List<Object> values = new ArrayList<>();
            extract(doc, 0, values);

            for (Object v : values) {
                seen.putIfAbsent(dedupKey(v), v);
            }
        });
        return new ArrayList<>(seen.values());
    }

    /**
     * all values found at the path of this helper
     */
    public List<Object> extract(Map<String, Object> doc) {
        List<Object> ret = new ArrayList<>();
        extract(doc, 0, ret);
        return ret;
    }

    /**
     * an explicit <code>null</code> at the end of the path is a value, a missing key is not
     */
    private void extract(Object value, int idx, List<Object> out) {
        if (idx == path.size()) {
            if (value instanceof List) {
                out.addAll((List<?>) value);
            } else {
                out.add(value);
            }

            return;
        }

        String segment = path.get(idx);

        if (value instanceof List) {
            List<?> lst = (List<?>) value;

            if (isIndex(segment)) {
                int i = Integer.parseInt(segment);
                if (i < lst.size()) extract(lst.get(i), idx + 1, out);
            } else {
                for (Object o : lst) {
                    extract(o, idx, out);
                }
            }
        } else if (value instanceof Map) {
            Map<?, ?> m = (Map<?, ?>) value;
            if (m.containsKey(segment)) extract(m.get(segment), idx + 1, out);
        }
    }

    private Object dedupKey(Object v) {
        if (v instanceof Map || v instanceof List) {
            return List.of(json.stableSerialize(v));
        }

        return v;
    }

    private static boolean isIndex(String s) {
        if (s.isEmpty() || s.length() > 9) return false;

        for (char c : s.toCharArray()) {
            if (c < '0' || c > '9') return false;
        }

        return true;
    }
}
