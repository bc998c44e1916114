package de.caluga.dataapi.driver.timeouts;

import java.util.Map;

/**
 * timeout budget of one logical operation. {@link #advance(RequestInfo)} is called before
 * every http attempt and tells how many ms that attempt may take.
 * Safe to share between threads working on the same operation.
 */
public class TimeoutManager {
    private final Map<TimeoutCategory, Long> initial;
    private final AdvanceFunction advanceFunction;
    private final TimeoutErrorFactory errorFactory;

    TimeoutManager(Map<TimeoutCategory, Long> initial, AdvanceFunction advanceFunction, TimeoutErrorFactory errorFactory) {
        this.initial = initial;
        this.advanceFunction = advanceFunction;
        this.errorFactory = errorFactory;
    }

    /**
     * the resolved budgets this manager works with
     */
    public Map<TimeoutCategory, Long> initial() {
        return initial;
    }

    public Advance advance(RequestInfo info) {
        Advance.Raw raw = advanceFunction.advance();
        return new Advance(raw.msRemaining, raw.categories, info, this);
    }

    RuntimeException mkTimeoutError(RequestInfo info, TimedOutCategories categories) {
        return errorFactory.create(info, this, categories);
    }

    @FunctionalInterface
    public interface AdvanceFunction {
        Advance.Raw advance();
    }

    /**
     * result of one {@link TimeoutManager#advance(RequestInfo)}
     */
    public static class Advance {
        private final long msRemaining;
        private final TimedOutCategories categories;
        private final RequestInfo info;
        private final TimeoutManager manager;

        Advance(long msRemaining, TimedOutCategories categories, RequestInfo info, TimeoutManager manager) {
            this.msRemaining = msRemaining;
            this.categories = categories;
            this.info = info;
            this.manager = manager;
        }

        public long getMsRemaining() {
            return msRemaining;
        }

        public boolean isExpired() {
            return msRemaining <= 0;
        }

        public TimedOutCategories getCategories() {
            return categories;
        }

        public RuntimeException mkTimeoutError() {
            return manager.mkTimeoutError(info, categories);
        }

        public static final class Raw {
            private final long msRemaining;
            private final TimedOutCategories categories;

            public Raw(long msRemaining, TimedOutCategories categories) {
                this.msRemaining = msRemaining;
                this.categories = categories;
            }
        }
    }
}
