package de.caluga.dataapi.driver;

import de.caluga.dataapi.bulk.InsertManyResult;

import java.util.List;

public class InsertManyException extends CumulativeDataApiException {
    public InsertManyException(List<DetailedErrorDescriptor> details, InsertManyResult partialResult) {
        super(details, partialResult);
    }

    @Override
    public InsertManyResult getPartialResult() {
        return (InsertManyResult) super.getPartialResult();
    }
}
