package dev.leaddispatch.exception;

import java.time.Duration;

/**
 * The external lookup provider did not answer within the configured timeout.
 */
public class LookupTimeoutException extends DispatchException {

    public LookupTimeoutException(Duration timeout, Throwable cause) {
        super("Lookup timed out after " + timeout.toMillis() + " ms", cause);
    }
}
