package de.caluga.dataapi.driver.http;

import de.caluga.dataapi.driver.Doc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * decoded response envelope <code>{status?, data?, errors?}</code>
 */
public class DataApiResponse {
    private final Doc raw;

    public DataApiResponse(Map<String, Object> raw) {
        this.raw = Doc.of(raw);
    }

    public Doc getRaw() {
        return raw;
    }

    /**
     * never null
     */
    public Doc getStatus() {
        Doc s = raw.getDoc("status");
        return s == null ? new Doc() : s;
    }

    /**
     * never null
     */
    public Doc getData() {
        Doc d = raw.getDoc("data");
        return d == null ? new Doc() : d;
    }

    public List<Map<String, Object>> getErrors() {
        return Doc.convertToMapList(raw.getList("errors"));
    }

    public List<Map<String, Object>> getDocuments() {
        List<Object> docs = getData().getList("documents");
        return docs == null ? new ArrayList<>() : Doc.convertToMapList(docs);
    }

    public Map<String, Object> getDocument() {
        return Doc.asMap(getData().get("document"));
    }

    /**
     * paging state of <code>data</code> or <code>status</code>, null if there are no more pages
     */
    public String getNextPageState() {
        String ps = getData().getString("nextPageState");
        if (ps == null) ps = getStatus().getString("nextPageState");
        return ps;
    }

    @Override
    public String toString() {
        return raw.toString();
    }
}
