package com.example.ordersync.domain.exception;

/**
 * Wraps an unclassified store or writer failure. Always transient.
 */
public class UnrecognizedOrderSyncException extends DomainException {

    public UnrecognizedOrderSyncException(String message, Throwable cause) {
        super(message, true, cause);
    }

    @Override
    public String getErrorCode() {
        return "UNRECOGNIZED";
    }
}
