package de.caluga.dataapi.driver.commands;

import de.caluga.dataapi.driver.Doc;

import java.util.Map;

public class FindOneAndDeleteCommand extends DataApiCommand<FindOneAndDeleteCommand> {
    private Map<String, Object> filter = new Doc();
    private Map<String, Object> sort;
    private Map<String, Object> projection;

    @Override
    public String getCommandName() {
        return "findOneAndDelete";
    }

    public Map<String, Object> getFilter() {
        return filter;
    }

    public FindOneAndDeleteCommand setFilter(Map<String, Object> filter) {
        this.filter = filter;
        return this;
    }

    public Map<String, Object> getSort() {
        return sort;
    }

    public FindOneAndDeleteCommand setSort(Map<String, Object> sort) {
        this.sort = sort;
        return this;
    }

    public Map<String, Object> getProjection() {
        return projection;
    }

    public FindOneAndDeleteCommand setProjection(Map<String, Object> projection) {
        this.projection = projection;
        return this;
    }
}
