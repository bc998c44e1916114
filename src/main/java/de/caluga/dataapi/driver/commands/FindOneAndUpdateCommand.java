package de.caluga.dataapi.driver.commands;

import de.caluga.dataapi.annotations.CommandOption;
import de.caluga.dataapi.driver.Doc;

import java.util.Map;

public class FindOneAndUpdateCommand extends DataApiCommand<FindOneAndUpdateCommand> {
    private Map<String, Object> filter = new Doc();
    private Map<String, Object> update;
    private Map<String, Object> sort;
    private Map<String, Object> projection;
    @CommandOption
    private String returnDocument;
    @CommandOption
    private Boolean upsert;

    @Override
    public String getCommandName() {
        return "findOneAndUpdate";
    }

    public Map<String, Object> getFilter() {
        return filter;
    }

    public FindOneAndUpdateCommand setFilter(Map<String, Object> filter) {
        this.filter = filter;
        return this;
    }

    public Map<String, Object> getUpdate() {
        return update;
    }

    public FindOneAndUpdateCommand setUpdate(Map<String, Object> update) {
        this.update = update;
        return this;
    }

    public Map<String, Object> getSort() {
        return sort;
    }

    public FindOneAndUpdateCommand setSort(Map<String, Object> sort) {
        this.sort = sort;
        return this;
    }

    public Map<String, Object> getProjection() {
        return projection;
    }

    public FindOneAndUpdateCommand setProjection(Map<String, Object> projection) {
        this.projection = projection;
        return this;
    }

    public String getReturnDocument() {
        return returnDocument;
    }

    public FindOneAndUpdateCommand setReturnDocument(String returnDocument) {
        this.returnDocument = returnDocument;
        return this;
    }

    public Boolean getUpsert() {
        return upsert;
    }

    public FindOneAndUpdateCommand setUpsert(Boolean upsert) {
        this.upsert = upsert;
        return this;
    }
}
