package de.caluga.dataapi.driver.commands;

public class EstimatedDocumentCountCommand extends DataApiCommand<EstimatedDocumentCountCommand> {
    @Override
    public String getCommandName() {
        return "estimatedDocumentCount";
    }
}
