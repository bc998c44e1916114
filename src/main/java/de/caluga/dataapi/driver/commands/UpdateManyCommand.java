package de.caluga.dataapi.driver.commands;

import de.caluga.dataapi.annotations.CommandOption;
import de.caluga.dataapi.driver.Doc;

import java.util.Map;

public class UpdateManyCommand extends DataApiCommand<UpdateManyCommand> {
    private Map<String, Object> filter = new Doc();
    private Map<String, Object> update;
    @CommandOption
    private Boolean upsert;
    @CommandOption
    private String pagingState;

    @Override
    public String getCommandName() {
        return "updateMany";
    }

    public Map<String, Object> getFilter() {
        return filter;
    }

    public UpdateManyCommand setFilter(Map<String, Object> filter) {
        this.filter = filter;
        return this;
    }

    public Map<String, Object> getUpdate() {
        return update;
    }

    public UpdateManyCommand setUpdate(Map<String, Object> update) {
        this.update = update;
        return this;
    }

    public Boolean getUpsert() {
        return upsert;
    }

    public UpdateManyCommand setUpsert(Boolean upsert) {
        this.upsert = upsert;
        return this;
    }

    public String getPagingState() {
        return pagingState;
    }

    public UpdateManyCommand setPagingState(String pagingState) {
        this.pagingState = pagingState;
        return this;
    }
}
