package de.caluga.dataapi.events;

import de.caluga.dataapi.driver.ErrorDescriptor;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class CommandWarningsEvent extends CommandEvent {
    private final List<ErrorDescriptor> warnings;

    public CommandWarningsEvent(String requestId, Map<String, Object> command, String keyspace, String collection, String url, List<ErrorDescriptor> warnings) {
        super("CommandWarnings", requestId, command, keyspace, collection, url);
        this.warnings = warnings;
    }

    public List<ErrorDescriptor> getWarnings() {
        return warnings;
    }

    @Override
    public DataApiEventType getType() {
        return DataApiEventType.COMMAND_WARNINGS;
    }

    @Override
    protected String describe() {
        return target() + " '" + warnings.stream().map(ErrorDescriptor::getMessage).collect(Collectors.joining(", ")) + "'";
    }

    @Override
    protected void addFields(Map<String, Object> fields) {
        super.addFields(fields);
        fields.put("warnings", warnings.stream().map(ErrorDescriptor::getMessage).collect(Collectors.toList()));
    }
}
