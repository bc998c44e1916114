package de.caluga.dataapi.driver.commands;

import de.caluga.dataapi.annotations.CommandOption;
import de.caluga.dataapi.driver.Doc;

import java.util.Map;

public class FindOneCommand extends DataApiCommand<FindOneCommand> {
    private Map<String, Object> filter = new Doc();
    private Map<String, Object> sort;
    private Map<String, Object> projection;
    @CommandOption
    private Boolean includeSimilarity;

    @Override
    public String getCommandName() {
        return "findOne";
    }

    public Map<String, Object> getFilter() {
        return filter;
    }

    public FindOneCommand setFilter(Map<String, Object> filter) {
        this.filter = filter;
        return this;
    }

    public Map<String, Object> getSort() {
        return sort;
    }

    public FindOneCommand setSort(Map<String, Object> sort) {
        this.sort = sort;
        return this;
    }

    public Map<String, Object> getProjection() {
        return projection;
    }

    public FindOneCommand setProjection(Map<String, Object> projection) {
        this.projection = projection;
        return this;
    }

    public Boolean getIncludeSimilarity() {
        return includeSimilarity;
    }

    public FindOneCommand setIncludeSimilarity(Boolean includeSimilarity) {
        this.includeSimilarity = includeSimilarity;
        return this;
    }
}
