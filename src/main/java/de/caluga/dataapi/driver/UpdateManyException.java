package de.caluga.dataapi.driver;

import de.caluga.dataapi.UpdateResult;

import java.util.List;

public class UpdateManyException extends CumulativeDataApiException {
    public UpdateManyException(List<DetailedErrorDescriptor> details, UpdateResult partialResult) {
        super(details, partialResult);
    }

    @Override
    public UpdateResult getPartialResult() {
        return (UpdateResult) super.getPartialResult();
    }
}
