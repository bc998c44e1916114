package de.caluga.dataapi.driver;

import java.util.List;

/**
 * http 401 or an "invalid token" error. Never retried.
 */
public class DataApiAuthenticationException extends DataApiResponseException {
    public static final String MESSAGE = "Authentication failed; is your token valid?";

    public DataApiAuthenticationException(List<DetailedErrorDescriptor> details) {
        super(MESSAGE, flatten(details), details);
    }
}
