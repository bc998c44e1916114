package de.caluga.dataapi.driver.commands;

import de.caluga.dataapi.annotations.CommandOption;
import de.caluga.dataapi.driver.Doc;

import java.util.Map;

public class UpdateOneCommand extends DataApiCommand<UpdateOneCommand> {
    private Map<String, Object> filter = new Doc();
    private Map<String, Object> update;
    private Map<String, Object> sort;
    @CommandOption
    private Boolean upsert;

    @Override
    public String getCommandName() {
        return "updateOne";
    }

    public Map<String, Object> getFilter() {
        return filter;
    }

    public UpdateOneCommand setFilter(Map<String, Object> filter) {
        this.filter = filter;
        return this;
    }

    public Map<String, Object> getUpdate() {
        return update;
    }

    public UpdateOneCommand setUpdate(Map<String, Object> update) {
        this.update = update;
        return this;
    }

    public Map<String, Object> getSort() {
        return sort;
    }

    public UpdateOneCommand setSort(Map<String, Object> sort) {
        this.sort = sort;
        return this;
    }

    public Boolean getUpsert() {
        return upsert;
    }

    public UpdateOneCommand setUpsert(Boolean upsert) {
        this.upsert = upsert;
        return this;
    }
}
