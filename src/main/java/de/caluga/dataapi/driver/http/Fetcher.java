package de.caluga.dataapi.driver.http;

/**
 * performs a single http request. Implementations throw
 * {@link de.caluga.dataapi.driver.DataApiNetworkException} on I/O failures and the exception
 * produced by {@link FetcherRequest#mkTimeoutError()} when the request runs into its timeout.
 */
public interface Fetcher {

    FetcherResponse fetch(FetcherRequest request);

    default void close() {
    }
}
