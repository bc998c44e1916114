package de.caluga.dataapi.driver;

import java.util.List;

public class CollectionNotFoundException extends DataApiResponseException {
    private final String collectionName;

    public CollectionNotFoundException(String keyspace, String collectionName, List<DetailedErrorDescriptor> details) {
        super("Collection '" + keyspace + "." + collectionName + "' not found", flatten(details), details);
        this.collectionName = collectionName;
        setKeyspace(keyspace);
        setCollection(collectionName);
    }

    public String getCollectionName() {
        return collectionName;
    }
}
