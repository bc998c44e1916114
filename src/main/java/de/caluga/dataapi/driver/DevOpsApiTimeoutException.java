package de.caluga.dataapi.driver;

import de.caluga.dataapi.driver.timeouts.RequestInfo;
import de.caluga.dataapi.driver.timeouts.TimedOutCategories;
import de.caluga.dataapi.driver.timeouts.TimeoutCategory;
import de.caluga.dataapi.driver.timeouts.TimeoutManager;
import de.caluga.dataapi.driver.timeouts.Timeouts;

import java.util.Map;

public class DevOpsApiTimeoutException extends DevOpsApiException {
    private final String url;
    private final Map<TimeoutCategory, Long> timeout;
    private final TimedOutCategories timedOutCategories;

    public DevOpsApiTimeoutException(RequestInfo info, TimeoutManager tm, TimedOutCategories categories) {
        super(Timeouts.fmtTimeoutMsg(tm, categories));
        this.url = info == null ? null : info.getUrl();
        this.timeout = tm.initial();
        this.timedOutCategories = categories;
    }

    public String getUrl() {
        return url;
    }

    public Map<TimeoutCategory, Long> getTimeout() {
        return timeout;
    }

    public TimedOutCategories getTimedOutCategories() {
        return timedOutCategories;
    }
}
