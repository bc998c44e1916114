package de.caluga.dataapi.events;

import de.caluga.dataapi.driver.ErrorDescriptor;
import de.caluga.dataapi.driver.http.DevOpsRequest;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class AdminCommandWarningsEvent extends AdminCommandEvent {
    private final List<ErrorDescriptor> warnings;

    public AdminCommandWarningsEvent(String requestId, DevOpsRequest req, boolean longRunning, List<ErrorDescriptor> warnings) {
        super("AdminCommandWarnings", requestId, req, longRunning);
        this.warnings = warnings;
    }

    public List<ErrorDescriptor> getWarnings() {
        return warnings;
    }

    @Override
    public DataApiEventType getType() {
        return DataApiEventType.ADMIN_COMMAND_WARNINGS;
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
