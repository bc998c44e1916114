package de.caluga.dataapi.driver;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * one entry of the <code>errors</code> (or <code>status.warnings</code>) array of a response
 */
public class ErrorDescriptor {
    private final String errorCode;
    private final String message;
    private final Map<String, Object> attributes;

    public ErrorDescriptor(String errorCode, String message, Map<String, Object> attributes) {
        this.errorCode = errorCode;
        this.message = message;
        this.attributes = attributes == null ? Map.of() : attributes;
    }

    public static ErrorDescriptor fromMap(Map<String, Object> error) {
        Map<String, Object> attributes = new LinkedHashMap<>(error);
        attributes.remove("message");
        attributes.remove("errorCode");
        Object code = error.get("errorCode");
        Object msg = error.get("message");
        return new ErrorDescriptor(code == null ? null : code.toString(), msg == null ? null : msg.toString(), attributes);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getMessage() {
        return message;
    }

    /**
     * all other fields of the error entry, e.g. <code>id</code>, <code>title</code>, <code>family</code>
     */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return "ErrorDescriptor{" + "errorCode='" + errorCode + '\'' + ", message='" + message + '\'' + ", attributes=" + attributes + '}';
    }
}
