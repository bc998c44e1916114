package de.caluga.dataapi.driver;

/**
 * the transport failed before a http status was received
 */
public class DataApiNetworkException extends DataApiDriverException {

    public DataApiNetworkException(String message) {
        super(message);
    }

    public DataApiNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
