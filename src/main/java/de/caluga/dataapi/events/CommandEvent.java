package de.caluga.dataapi.events;

import java.util.Map;

/**
 * events around a single Data API command
 */
public abstract class CommandEvent extends DataApiEvent {
    private final Map<String, Object> command;
    private final String keyspace;
    private final String collection;
    private final String commandName;
    private final String url;

    protected CommandEvent(String name, String requestId, Map<String, Object> command, String keyspace, String collection, String url) {
        super(name, requestId);
        this.command = command;
        this.keyspace = keyspace;
        this.collection = collection;
        this.commandName = command == null || command.isEmpty() ? null : command.keySet().iterator().next();
        this.url = url;
    }

    public Map<String, Object> getCommand() {
        return command;
    }

    public String getKeyspace() {
        return keyspace;
    }

    /**
     * collection or table the command targets, null for keyspace level commands
     */
    public String getCollection() {
        return collection;
    }

    public String getCommandName() {
        return commandName;
    }

    public String getUrl() {
        return url;
    }

    protected String target() {
        return "(" + keyspace + (collection != null ? "." + collection : "") + ") " + commandName;
    }

    @Override
    protected void addFields(Map<String, Object> fields) {
        fields.put("commandName", commandName);
        fields.put("keyspace", keyspace);
        fields.put("collection", collection);
        fields.put("url", url);
        fields.put("command", command);
    }
}
