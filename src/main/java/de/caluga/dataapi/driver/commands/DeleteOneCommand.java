package de.caluga.dataapi.driver.commands;

import de.caluga.dataapi.driver.Doc;

import java.util.Map;

public class DeleteOneCommand extends DataApiCommand<DeleteOneCommand> {
    private Map<String, Object> filter = new Doc();
    private Map<String, Object> sort;

    @Override
    public String getCommandName() {
        return "deleteOne";
    }

    public Map<String, Object> getFilter() {
        return filter;
    }

    public DeleteOneCommand setFilter(Map<String, Object> filter) {
        this.filter = filter;
        return this;
    }

    public Map<String, Object> getSort() {
        return sort;
    }

    public DeleteOneCommand setSort(Map<String, Object> sort) {
        this.sort = sort;
        return this;
    }
}
