package de.caluga.dataapi.query;

import de.caluga.dataapi.driver.Doc;

import java.util.Map;

public final class SortHelper {
    private SortHelper() {
    }

    /**
     * replaces "asc"/"ascending" by 1 and "desc"/"descending" by -1, other values (numbers, vectors, $vectorize text)
     * are passed on as they are. Returns null for null.
     */
    public static Doc normalize(Map<String, Object> sort) {
        if (sort == null) return null;
        Doc ret = new Doc();

        for (Map.Entry<String, Object> e : sort.entrySet()) {
            Object v = e.getValue();

            if (v instanceof String && !e.getKey().startsWith("$")) {
                switch (((String) v).toLowerCase()) {
                    case "asc":
                    case "ascending":
                        v = 1;
                        break;
                    case "desc":
                    case "descending":
                        v = -1;
                        break;
                    default:
                        break;
                }
            }

            ret.put(e.getKey(), v);
        }

        return ret;
    }
}
