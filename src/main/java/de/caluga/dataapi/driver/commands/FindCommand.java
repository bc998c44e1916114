package de.caluga.dataapi.driver.commands;

import de.caluga.dataapi.annotations.CommandOption;
import de.caluga.dataapi.driver.Doc;

import java.util.Map;

public class FindCommand extends DataApiCommand<FindCommand> {
    private Map<String, Object> filter = new Doc();
    private Map<String, Object> sort;
    private Map<String, Object> projection;
    @CommandOption
    private Integer limit;
    @CommandOption
    private Integer skip;
    @CommandOption
    private String pagingState;
    @CommandOption
    private Boolean includeSimilarity;

    @Override
    public String getCommandName() {
        return "find";
    }

    public Map<String, Object> getFilter() {
        return filter;
    }

    public FindCommand setFilter(Map<String, Object> filter) {
        this.filter = filter;
        return this;
    }

    public Map<String, Object> getSort() {
        return sort;
    }

    public FindCommand setSort(Map<String, Object> sort) {
        this.sort = sort;
        return this;
    }

    public Map<String, Object> getProjection() {
        return projection;
    }

    public FindCommand setProjection(Map<String, Object> projection) {
        this.projection = projection;
        return this;
    }

    public Integer getLimit() {
        return limit;
    }

    public FindCommand setLimit(Integer limit) {
        this.limit = limit;
        return this;
    }

    public Integer getSkip() {
        return skip;
    }

    public FindCommand setSkip(Integer skip) {
        this.skip = skip;
        return this;
    }

    public String getPagingState() {
        return pagingState;
    }

    public FindCommand setPagingState(String pagingState) {
        this.pagingState = pagingState;
        return this;
    }

    public Boolean getIncludeSimilarity() {
        return includeSimilarity;
    }

    public FindCommand setIncludeSimilarity(Boolean includeSimilarity) {
        this.includeSimilarity = includeSimilarity;
        return this;
    }
}
