package de.caluga.dataapi.driver.timeouts;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * creates {@link TimeoutManager}s from the client wide base descriptor and per call overrides
 */
public class Timeouts {
    public static final long EFFECTIVELY_INFINITY = (1L << 31) - 1;

    private final TimeoutErrorFactory errorFactory;
    private final TimeoutDescriptor baseTimeouts;
    private final TimeSource timeSource;

    public Timeouts(TimeoutErrorFactory errorFactory, TimeoutDescriptor baseTimeouts, TimeSource timeSource) {
        this.errorFactory = errorFactory;
        this.baseTimeouts = TimeoutDescriptor.merge(TimeoutDescriptor.defaults(), baseTimeouts);
        this.timeSource = timeSource == null ? TimeSource.system() : timeSource;
    }

    public TimeoutDescriptor getBaseTimeouts() {
        return baseTimeouts;
    }

    public TimeSource getTimeSource() {
        return timeSource;
    }

    /**
     * for operations doing exactly one http request
     */
    public TimeoutManager single(TimeoutCategory key, TimeoutOverride override) {
        checkKey(key);
        long requestTimeout;
        long keyTimeout;

        if (override != null && override.isFlat()) {
            requestTimeout = orInfinity(override.getFlatMs());
            keyTimeout = requestTimeout;
        } else {
            TimeoutDescriptor o = override == null ? null : override.getDescriptor();
            requestTimeout = orInfinity(resolve(o, TimeoutCategory.REQUEST));
            keyTimeout = orInfinity(resolve(o, key));
        }

        long timeout = Math.min(requestTimeout, keyTimeout);
        TimedOutCategories type;

        if (requestTimeout == keyTimeout) {
            type = TimedOutCategories.both(TimeoutCategory.REQUEST, key);
        } else if (requestTimeout < keyTimeout) {
            type = TimedOutCategories.of(TimeoutCategory.REQUEST);
        } else {
            type = TimedOutCategories.of(key);
        }

        TimeoutManager.Advance.Raw result = new TimeoutManager.Advance.Raw(timeout, type);
        return custom(initial(requestTimeout, key, keyTimeout), () -> result);
    }

    /**
     * for operations doing several http requests against one overall deadline.
     * The clock starts with the first advance.
     */
    public TimeoutManager multipart(TimeoutCategory key, TimeoutOverride override) {
        checkKey(key);
        long requestTimeout;
        long overallTimeout;

        if (override != null && override.isFlat()) {
            requestTimeout = orInfinity(baseTimeouts.get(TimeoutCategory.REQUEST));
            overallTimeout = orInfinity(override.getFlatMs());
        } else {
            TimeoutDescriptor o = override == null ? null : override.getDescriptor();
            requestTimeout = orInfinity(resolve(o, TimeoutCategory.REQUEST));
            overallTimeout = orInfinity(resolve(o, key));
        }

        AtomicLong started = new AtomicLong(-1);

        return custom(initial(requestTimeout, key, overallTimeout), () -> {
            started.compareAndSet(-1, timeSource.currentTimeMillis());
            long overallLeft = overallTimeout - (timeSource.currentTimeMillis() - started.get());

            if (overallLeft < requestTimeout) {
                return new TimeoutManager.Advance.Raw(overallLeft, TimedOutCategories.of(key));
            } else if (overallLeft > requestTimeout) {
                return new TimeoutManager.Advance.Raw(requestTimeout, TimedOutCategories.of(TimeoutCategory.REQUEST));
            } else {
                return new TimeoutManager.Advance.Raw(overallLeft, TimedOutCategories.both(TimeoutCategory.REQUEST, key));
            }
        });
    }

    public TimeoutManager custom(Map<TimeoutCategory, Long> initial, TimeoutManager.AdvanceFunction advance) {
        return new TimeoutManager(Collections.unmodifiableMap(initial), advance, errorFactory);
    }

    public static TimeoutDescriptor merge(TimeoutDescriptor base, TimeoutDescriptor override) {
        return TimeoutDescriptor.merge(base, override);
    }

    public static String fmtTimeoutMsg(TimeoutManager tm, TimedOutCategories categories) {
        Long timeout;

        if (categories.isProvided()) {
            timeout = tm.initial().isEmpty() ? null : tm.initial().values().iterator().next();
        } else {
            timeout = tm.initial().get(categories.first());
        }

        return "Command timed out after " + timeout + "ms (" + categories.describe() + ")";
    }

    private long resolve(TimeoutDescriptor override, TimeoutCategory c) {
        if (override != null && override.has(c)) return override.get(c);
        return baseTimeouts.get(c);
    }

    private static long orInfinity(Long ms) {
        if (ms == null || ms == 0) return EFFECTIVELY_INFINITY;
        return ms;
    }

    private static Map<TimeoutCategory, Long> initial(long requestTimeout, TimeoutCategory key, long keyTimeout) {
        Map<TimeoutCategory, Long> ret = new EnumMap<>(TimeoutCategory.class);
        ret.put(TimeoutCategory.REQUEST, requestTimeout);
        ret.put(key, keyTimeout);
        return ret;
    }

    private static void checkKey(TimeoutCategory key) {
        if (key == TimeoutCategory.REQUEST) {
            throw new IllegalArgumentException("requestTimeoutMs is not an operation level timeout category");
        }
    }
}
