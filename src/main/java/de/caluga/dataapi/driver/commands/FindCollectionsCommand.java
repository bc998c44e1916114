package de.caluga.dataapi.driver.commands;

import de.caluga.dataapi.annotations.CommandOption;

public class FindCollectionsCommand extends DataApiCommand<FindCollectionsCommand> {
    @CommandOption
    private Boolean explain;

    @Override
    public String getCommandName() {
        return "findCollections";
    }

    public Boolean getExplain() {
        return explain;
    }

    public FindCollectionsCommand setExplain(Boolean explain) {
        this.explain = explain;
        return this;
    }
}
