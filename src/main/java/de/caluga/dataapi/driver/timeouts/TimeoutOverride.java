package de.caluga.dataapi.driver.timeouts;

/**
 * caller supplied timeout for one operation: either a flat number of ms, applying to
 * every category relevant for the operation, or a partial {@link TimeoutDescriptor}
 */
public final class TimeoutOverride {
    private final Long flatMs;
    private final TimeoutDescriptor descriptor;

    private TimeoutOverride(Long flatMs, TimeoutDescriptor descriptor) {
        this.flatMs = flatMs;
        this.descriptor = descriptor;
    }

    public static TimeoutOverride ofMillis(long ms) {
        if (ms < 0) throw new IllegalArgumentException("timeout must not be negative: " + ms);
        return new TimeoutOverride(ms, null);
    }

    public static TimeoutOverride of(TimeoutDescriptor partial) {
        return new TimeoutOverride(null, partial);
    }

    public boolean isFlat() {
        return flatMs != null;
    }

    public Long getFlatMs() {
        return flatMs;
    }

    public TimeoutDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public String toString() {
        return isFlat() ? flatMs + "ms" : String.valueOf(descriptor);
    }
}
