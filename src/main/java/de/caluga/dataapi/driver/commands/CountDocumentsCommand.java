package de.caluga.dataapi.driver.commands;

import de.caluga.dataapi.driver.Doc;

import java.util.Map;

public class CountDocumentsCommand extends DataApiCommand<CountDocumentsCommand> {
    private Map<String, Object> filter = new Doc();

    @Override
    public String getCommandName() {
        return "countDocuments";
    }

    public Map<String, Object> getFilter() {
        return filter;
    }

    public CountDocumentsCommand setFilter(Map<String, Object> filter) {
        this.filter = filter;
        return this;
    }
}
