package de.caluga.dataapi.driver.timeouts;

import java.util.List;
import java.util.stream.Collectors;

/**
 * the category (or categories, if they expire at the same time) responsible for a timeout.
 * "provided" is used by custom managers that work with a single caller given budget.
 */
public final class TimedOutCategories {
    private static final TimedOutCategories PROVIDED = new TimedOutCategories(List.of());
    private final List<TimeoutCategory> categories;

    private TimedOutCategories(List<TimeoutCategory> categories) {
        this.categories = categories;
    }

    public static TimedOutCategories of(TimeoutCategory c) {
        return new TimedOutCategories(List.of(c));
    }

    public static TimedOutCategories both(TimeoutCategory a, TimeoutCategory b) {
        return new TimedOutCategories(List.of(a, b));
    }

    public static TimedOutCategories provided() {
        return PROVIDED;
    }

    public boolean isProvided() {
        return categories.isEmpty();
    }

    public boolean isSimultaneous() {
        return categories.size() > 1;
    }

    public List<TimeoutCategory> getCategories() {
        return categories;
    }

    public TimeoutCategory first() {
        return categories.isEmpty() ? null : categories.get(0);
    }

    public String describe() {
        if (isProvided()) return "The timeout provided via `{ timeout: <number> }` timed out";
        if (isSimultaneous()) {
            return categories.stream().map(TimeoutCategory::getKey).collect(Collectors.joining(" and ")) + " simultaneously timed out";
        }
        return categories.get(0).getKey() + " timed out";
    }

    @Override
    public String toString() {
        return isProvided() ? "provided" : categories.toString();
    }
}
