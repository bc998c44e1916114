package de.caluga.dataapi.driver;

import de.caluga.dataapi.driver.timeouts.RequestInfo;
import de.caluga.dataapi.driver.timeouts.TimedOutCategories;
import de.caluga.dataapi.driver.timeouts.TimeoutCategory;
import de.caluga.dataapi.driver.timeouts.TimeoutManager;
import de.caluga.dataapi.driver.timeouts.Timeouts;

import java.util.Map;

/**
 * the budget of at least one {@link TimeoutCategory} ran out
 */
public class DataApiTimeoutException extends DataApiDriverException {
    private final String url;
    private final TimedOutCategories timedOutCategories;
    private final Map<TimeoutCategory, Long> timeout;

    public DataApiTimeoutException(RequestInfo info, TimeoutManager tm, TimedOutCategories categories) {
        super(Timeouts.fmtTimeoutMsg(tm, categories));
        this.url = info == null ? null : info.getUrl();
        this.timedOutCategories = categories;
        this.timeout = tm.initial();
    }

    public String getUrl() {
        return url;
    }

    public TimedOutCategories getTimedOutCategories() {
        return timedOutCategories;
    }

    public Map<TimeoutCategory, Long> getTimeout() {
        return timeout;
    }
}
