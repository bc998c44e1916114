package de.caluga.dataapi.driver;

import java.util.List;

/**
 * error of an operation spanning several http calls, carries what was done before the failure.
 * Subclasses narrow the type of {@link #getPartialResult()}.
 */
public abstract class CumulativeDataApiException extends DataApiResponseException {
    private final Object partialResult;

    protected CumulativeDataApiException(List<DetailedErrorDescriptor> details, Object partialResult) {
        super(details);
        this.partialResult = partialResult;
    }

    public Object getPartialResult() {
        return partialResult;
    }
}
