package dev.leaddispatch.exception;

/**
 * Base class for failures the command layer reports to the user with a reason.
 */
public class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
