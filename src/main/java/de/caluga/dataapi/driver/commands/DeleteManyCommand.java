package de.caluga.dataapi.driver.commands;

import de.caluga.dataapi.driver.Doc;

import java.util.Map;

public class DeleteManyCommand extends DataApiCommand<DeleteManyCommand> {
    private Map<String, Object> filter = new Doc();

    @Override
    public String getCommandName() {
        return "deleteMany";
    }

    public Map<String, Object> getFilter() {
        return filter;
    }

    public DeleteManyCommand setFilter(Map<String, Object> filter) {
        this.filter = filter;
        return this;
    }
}
