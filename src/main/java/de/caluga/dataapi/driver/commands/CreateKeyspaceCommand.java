package de.caluga.dataapi.driver.commands;

public class CreateKeyspaceCommand extends DataApiCommand<CreateKeyspaceCommand> {
    private String name;

    @Override
    public String getCommandName() {
        return "createKeyspace";
    }

    public String getName() {
        return name;
    }

    public CreateKeyspaceCommand setName(String name) {
        this.name = name;
        return this;
    }
}
