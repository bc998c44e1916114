package de.caluga.dataapi.driver.commands;

import de.caluga.dataapi.annotations.CommandOption;

import java.util.Map;

public class CreateCollectionCommand extends DataApiCommand<CreateCollectionCommand> {
    private String name;
    @CommandOption
    private Map<String, Object> vector;
    @CommandOption
    private Map<String, Object> indexing;
    @CommandOption
    private Map<String, Object> defaultId;

    @Override
    public String getCommandName() {
        return "createCollection";
    }

    public String getName() {
        return name;
    }

    public CreateCollectionCommand setName(String name) {
        this.name = name;
        return this;
    }

    public Map<String, Object> getVector() {
        return vector;
    }

    public CreateCollectionCommand setVector(Map<String, Object> vector) {
        this.vector = vector;
        return this;
    }

    public Map<String, Object> getIndexing() {
        return indexing;
    }

    public CreateCollectionCommand setIndexing(Map<String, Object> indexing) {
        this.indexing = indexing;
        return this;
    }

    public Map<String, Object> getDefaultId() {
        return defaultId;
    }

    public CreateCollectionCommand setDefaultId(Map<String, Object> defaultId) {
        this.defaultId = defaultId;
        return this;
    }
}
