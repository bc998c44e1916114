package de.caluga.dataapi.driver;

import java.util.List;

/**
 * partial result is the number of documents deleted before the failure
 */
public class DeleteManyException extends CumulativeDataApiException {
    public DeleteManyException(List<DetailedErrorDescriptor> details, long deletedCount) {
        super(details, deletedCount);
    }

    @Override
    public Long getPartialResult() {
        return (Long) super.getPartialResult();
    }
}
