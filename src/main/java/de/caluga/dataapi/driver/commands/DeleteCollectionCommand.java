package de.caluga.dataapi.driver.commands;

public class DeleteCollectionCommand extends DataApiCommand<DeleteCollectionCommand> {
    private String name;

    @Override
    public String getCommandName() {
        return "deleteCollection";
    }

    public String getName() {
        return name;
    }

    public DeleteCollectionCommand setName(String name) {
        this.name = name;
        return this;
    }
}
