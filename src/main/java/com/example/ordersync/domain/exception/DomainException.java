package com.example.ordersync.domain.exception;

/**
 * Base class for failures raised by the order domain.
 * Every domain failure states whether re-processing the same input could succeed later.
 */
public abstract class DomainException extends RuntimeException {

    private final boolean transientFailure;

    protected DomainException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    protected DomainException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    /**
     * Returns true if the same input may succeed when re-delivered.
     */
    public boolean isTransient() {
        return transientFailure;
    }

    /**
     * Returns a stable machine-readable code for this failure.
     */
    public abstract String getErrorCode();
}
