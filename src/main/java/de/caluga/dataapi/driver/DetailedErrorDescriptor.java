package de.caluga.dataapi.driver;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * errors of a single http response together with the command that caused them
 */
public class DetailedErrorDescriptor {
    private final List<ErrorDescriptor> errorDescriptors;
    private final Map<String, Object> command;
    private final Map<String, Object> rawResponse;

    public DetailedErrorDescriptor(List<ErrorDescriptor> errorDescriptors, Map<String, Object> command, Map<String, Object> rawResponse) {
        this.errorDescriptors = errorDescriptors;
        this.command = command;
        this.rawResponse = rawResponse;
    }

    /**
     * @return null, if the response carries no errors
     */
    public static DetailedErrorDescriptor fromResponse(Map<String, Object> command, Map<String, Object> rawResponse) {
        if (rawResponse == null || !(rawResponse.get("errors") instanceof List)) return null;
        List<ErrorDescriptor> descriptors = new ArrayList<>();

        for (Map<String, Object> err : Doc.convertToMapList((List<?>) rawResponse.get("errors"))) {
            if (err != null) descriptors.add(ErrorDescriptor.fromMap(err));
        }

        return new DetailedErrorDescriptor(descriptors, command, rawResponse);
    }

    public List<ErrorDescriptor> getErrorDescriptors() {
        return errorDescriptors;
    }

    public Map<String, Object> getCommand() {
        return command;
    }

    public Map<String, Object> getRawResponse() {
        return rawResponse;
    }
}
