package de.caluga.dataapi.driver;

/**
 * base of errors raised by DevOps API calls
 */
public abstract class DevOpsApiException extends DataApiDriverException {
    protected DevOpsApiException(String message) {
        super(message);
    }
}
