package de.caluga.dataapi.driver;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * the Data API answered, but the <code>errors</code> array was not empty.
 * The message is always the message of the first error descriptor.
 */
public class DataApiResponseException extends DataApiDriverException {
    private final List<ErrorDescriptor> errorDescriptors;
    private final List<DetailedErrorDescriptor> detailedErrorDescriptors;

    public DataApiResponseException(String message, List<ErrorDescriptor> errorDescriptors, List<DetailedErrorDescriptor> detailedErrorDescriptors) {
        super(message);
        this.errorDescriptors = errorDescriptors == null ? List.of() : errorDescriptors;
        this.detailedErrorDescriptors = detailedErrorDescriptors == null ? List.of() : detailedErrorDescriptors;
    }

    public DataApiResponseException(List<DetailedErrorDescriptor> detailedErrorDescriptors) {
        this(messageOf(flatten(detailedErrorDescriptors)), flatten(detailedErrorDescriptors), detailedErrorDescriptors);
    }

    public static DataApiResponseException fromResponse(Map<String, Object> command, Map<String, Object> rawResponse) {
        DetailedErrorDescriptor d = DetailedErrorDescriptor.fromResponse(command, rawResponse);
        return new DataApiResponseException(d == null ? List.of() : List.of(d));
    }

    protected static List<ErrorDescriptor> flatten(List<DetailedErrorDescriptor> details) {
        List<ErrorDescriptor> ret = new ArrayList<>();
        if (details == null) return ret;

        for (DetailedErrorDescriptor d : details) {
            ret.addAll(d.getErrorDescriptors());
        }

        return ret;
    }

    protected static String messageOf(List<ErrorDescriptor> descriptors) {
        if (descriptors.isEmpty() || descriptors.get(0).getMessage() == null || descriptors.get(0).getMessage().isEmpty()) {
            return "Something unexpected occurred";
        }

        return descriptors.get(0).getMessage();
    }

    public List<ErrorDescriptor> getErrorDescriptors() {
        return errorDescriptors;
    }

    public List<DetailedErrorDescriptor> getDetailedErrorDescriptors() {
        return detailedErrorDescriptors;
    }

    /**
     * raw response of the first failed call, if there is one
     */
    public Map<String, Object> getRawResponse() {
        if (detailedErrorDescriptors.isEmpty()) return null;
        return detailedErrorDescriptors.get(0).getRawResponse();
    }
}
