package de.caluga.dataapi.driver.commands;

public class DropKeyspaceCommand extends DataApiCommand<DropKeyspaceCommand> {
    private String name;

    @Override
    public String getCommandName() {
        return "dropKeyspace";
    }

    public String getName() {
        return name;
    }

    public DropKeyspaceCommand setName(String name) {
        this.name = name;
        return this;
    }
}
