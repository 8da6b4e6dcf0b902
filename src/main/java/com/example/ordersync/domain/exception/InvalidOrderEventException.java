package com.example.ordersync.domain.exception;

/**
 * Thrown when an incoming order event is malformed or misses required fields.
 */
public class InvalidOrderEventException extends DomainException {

    public InvalidOrderEventException(String message) {
        super(message, false);
    }

    public InvalidOrderEventException(String message, Throwable cause) {
        super(message, false, cause);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_INPUT";
    }
}
