package de.caluga.dataapi.driver.commands;

public class FindKeyspacesCommand extends DataApiCommand<FindKeyspacesCommand> {
    @Override
    public String getCommandName() {
        return "findKeyspaces";
    }
}
