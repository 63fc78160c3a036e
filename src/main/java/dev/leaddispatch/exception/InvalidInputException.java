package dev.leaddispatch.exception;

public class InvalidInputException extends DispatchException {

    public InvalidInputException(String message) {
        super(message);
    }
}
