package de.caluga.dataapi.driver.commands;

import java.util.Map;

public class InsertOneCommand extends DataApiCommand<InsertOneCommand> {
    private Map<String, Object> document;

    @Override
    public String getCommandName() {
        return "insertOne";
    }

    public Map<String, Object> getDocument() {
        return document;
    }

    public InsertOneCommand setDocument(Map<String, Object> document) {
        this.document = document;
        return this;
    }
}
