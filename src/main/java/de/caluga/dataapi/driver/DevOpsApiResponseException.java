package de.caluga.dataapi.driver;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * DevOps API answered with http status &gt;= 400
 */
public class DevOpsApiResponseException extends DevOpsApiException {
    private final int status;
    private final List<DevOpsErrorDescriptor> errors;
    private final Object raw;

    public DevOpsApiResponseException(int status, Object data) {
        this(status, extractErrors(data), data);
    }

    private DevOpsApiResponseException(int status, List<DevOpsErrorDescriptor> errors, Object raw) {
        super(messageOf(errors));
        this.status = status;
        this.errors = errors;
        this.raw = raw;
    }

    private static String messageOf(List<DevOpsErrorDescriptor> errors) {
        for (DevOpsErrorDescriptor e : errors) {
            if (e.getMessage() != null && !e.getMessage().isEmpty()) {
                return e.getMessage() + (errors.size() > 1 ? " (+ " + (errors.size() - 1) + " more errors)" : "");
            }
        }

        return "Something went wrong";
    }

    private static List<DevOpsErrorDescriptor> extractErrors(Object data) {
        List<DevOpsErrorDescriptor> ret = new ArrayList<>();
        Map<String, Object> m = Doc.asMap(data);
        if (m == null || !(m.get("errors") instanceof List)) return ret;

        for (Map<String, Object> e : Doc.convertToMapList((List<?>) m.get("errors"))) {
            if (e == null) continue;
            Object id = e.get("ID");
            Object msg = e.get("message");
            ret.add(new DevOpsErrorDescriptor(id instanceof Number ? ((Number) id).intValue() : null, msg == null ? null : msg.toString()));
        }

        return ret;
    }

    public int getStatus() {
        return status;
    }

    public List<DevOpsErrorDescriptor> getErrors() {
        return errors;
    }

    /**
     * parsed response body
     */
    public Object getRaw() {
        return raw;
    }

    public static class DevOpsErrorDescriptor {
        private final Integer id;
        private final String message;

        public DevOpsErrorDescriptor(Integer id, String message) {
            this.id = id;
            this.message = message;
        }

        public Integer getId() {
            return id;
        }

        public String getMessage() {
            return message;
        }
    }
}
