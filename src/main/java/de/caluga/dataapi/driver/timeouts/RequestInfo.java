package de.caluga.dataapi.driver.timeouts;

/**
 * minimal view on an http request, used when building timeout errors
 */
public interface RequestInfo {
    String getUrl();

    String getMethod();
}
