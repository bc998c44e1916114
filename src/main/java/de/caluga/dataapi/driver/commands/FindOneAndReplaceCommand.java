package de.caluga.dataapi.driver.commands;

import de.caluga.dataapi.annotations.CommandOption;
import de.caluga.dataapi.driver.Doc;

import java.util.Map;

public class FindOneAndReplaceCommand extends DataApiCommand<FindOneAndReplaceCommand> {
    private Map<String, Object> filter = new Doc();
    private Map<String, Object> replacement;
    private Map<String, Object> sort;
    private Map<String, Object> projection;
    @CommandOption
    private String returnDocument;
    @CommandOption
    private Boolean upsert;

    @Override
    public String getCommandName() {
        return "findOneAndReplace";
    }

    public Map<String, Object> getFilter() {
        return filter;
    }

    public FindOneAndReplaceCommand setFilter(Map<String, Object> filter) {
        this.filter = filter;
        return this;
    }

    public Map<String, Object> getReplacement() {
        return replacement;
    }

    public FindOneAndReplaceCommand setReplacement(Map<String, Object> replacement) {
        this.replacement = replacement;
        return this;
    }

    public Map<String, Object> getSort() {
        return sort;
    }

    public FindOneAndReplaceCommand setSort(Map<String, Object> sort) {
        this.sort = sort;
        return this;
    }

    public Map<String, Object> getProjection() {
        return projection;
    }

    public FindOneAndReplaceCommand setProjection(Map<String, Object> projection) {
        this.projection = projection;
        return this;
    }

    public String getReturnDocument() {
        return returnDocument;
    }

    public FindOneAndReplaceCommand setReturnDocument(String returnDocument) {
        this.returnDocument = returnDocument;
        return this;
    }

    public Boolean getUpsert() {
        return upsert;
    }

    public FindOneAndReplaceCommand setUpsert(Boolean upsert) {
        this.upsert = upsert;
        return this;
    }
}
