package de.caluga.dataapi.driver.timeouts;

@FunctionalInterface
public interface TimeoutErrorFactory {
    RuntimeException create(RequestInfo info, TimeoutManager tm, TimedOutCategories categories);
}
