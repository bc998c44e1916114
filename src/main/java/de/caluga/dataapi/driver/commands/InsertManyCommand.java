package de.caluga.dataapi.driver.commands;

import de.caluga.dataapi.annotations.CommandOption;

import java.util.List;

public class InsertManyCommand extends DataApiCommand<InsertManyCommand> {
    private List<Object> documents;
    @CommandOption
    private Boolean ordered;
    @CommandOption
    private Boolean returnDocumentResponses;

    @Override
    public String getCommandName() {
        return "insertMany";
    }

    public List<Object> getDocuments() {
        return documents;
    }

    public InsertManyCommand setDocuments(List<Object> documents) {
        this.documents = documents;
        return this;
    }

    public Boolean getOrdered() {
        return ordered;
    }

    public InsertManyCommand setOrdered(Boolean ordered) {
        this.ordered = ordered;
        return this;
    }

    public Boolean getReturnDocumentResponses() {
        return returnDocumentResponses;
    }

    public InsertManyCommand setReturnDocumentResponses(Boolean returnDocumentResponses) {
        this.returnDocumentResponses = returnDocumentResponses;
        return this;
    }
}
