package de.caluga.dataapi.driver;

import java.util.Map;

/**
 * error during accessing the data api or the devops api. Unchecked, all other client errors derive from it.
 **/
public class DataApiDriverException extends RuntimeException {
    private String keyspace;
    private String collection;
    private Map<String, Object> command;

    public DataApiDriverException(String message) {
        super(message);
    }

    public DataApiDriverException(String message, Throwable cause) {
        super(message, cause);
    }

    public DataApiDriverException(String message, Throwable cause, String keyspace, String collection, Map<String, Object> command) {
        super(message, cause);
        this.keyspace = keyspace;
        this.collection = collection;
        this.command = command;
    }

    public String getKeyspace() {
        return keyspace;
    }

    public DataApiDriverException setKeyspace(String keyspace) {
        this.keyspace = keyspace;
        return this;
    }

    public String getCollection() {
        return collection;
    }

    public DataApiDriverException setCollection(String collection) {
        this.collection = collection;
        return this;
    }

    public Map<String, Object> getCommand() {
        return command;
    }

    public DataApiDriverException setCommand(Map<String, Object> command) {
        this.command = command;
        return this;
    }
}
