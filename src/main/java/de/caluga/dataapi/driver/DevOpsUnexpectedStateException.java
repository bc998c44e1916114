package de.caluga.dataapi.driver;

import java.util.List;
import java.util.Map;

/**
 * a polled resource reached a state that is neither the target nor one of the legal intermediate states
 */
public class DevOpsUnexpectedStateException extends DevOpsApiException {
    private final List<String> expected;
    private final Map<String, Object> dbInfo;

    public DevOpsUnexpectedStateException(String message, List<String> expected, Map<String, Object> dbInfo) {
        super(message);
        this.expected = expected;
        this.dbInfo = dbInfo;
    }

    public List<String> getExpected() {
        return expected;
    }

    public Map<String, Object> getDbInfo() {
        return dbInfo;
    }
}
