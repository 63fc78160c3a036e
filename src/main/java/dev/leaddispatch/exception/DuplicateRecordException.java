package dev.leaddispatch.exception;

public class DuplicateRecordException extends DispatchException {

    public DuplicateRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
