package de.caluga.dataapi.driver.http;

import de.caluga.dataapi.admin.AdminBlockingOptions;
import de.caluga.dataapi.driver.timeouts.TimeoutCategory;

import java.util.List;
import java.util.function.Function;

/**
 * describes how to wait for an admin operation: which database to poll and which states to expect
 */
public class LongRunningRequest {
    private final Function<DevOpsResponse, String> idExtractor;
    private final String target;
    private final List<String> legalStates;
    private final long defaultPollIntervalMs;
    private final TimeoutCategory category;
    private final AdminBlockingOptions options;

    public LongRunningRequest(Function<DevOpsResponse, String> idExtractor, String target, List<String> legalStates, long defaultPollIntervalMs, TimeoutCategory category, AdminBlockingOptions options) {
        this.idExtractor = idExtractor;
        this.target = target;
        this.legalStates = legalStates;
        this.defaultPollIntervalMs = defaultPollIntervalMs;
        this.category = category;
        this.options = options == null ? new AdminBlockingOptions() : options;
    }

    public LongRunningRequest(String id, String target, List<String> legalStates, long defaultPollIntervalMs, TimeoutCategory category, AdminBlockingOptions options) {
        this(r -> id, target, legalStates, defaultPollIntervalMs, category, options);
    }

    public String idFor(DevOpsResponse initial) {
        return idExtractor.apply(initial);
    }

    public String getTarget() {
        return target;
    }

    public List<String> getLegalStates() {
        return legalStates;
    }

    public long getPollIntervalMs() {
        return options.getPollIntervalMs() > 0 ? options.getPollIntervalMs() : defaultPollIntervalMs;
    }

    public TimeoutCategory getCategory() {
        return category;
    }

    public AdminBlockingOptions getOptions() {
        return options;
    }
}
