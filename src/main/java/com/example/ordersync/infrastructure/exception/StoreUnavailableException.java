package com.example.ordersync.infrastructure.exception;

/**
 * The order store or event store could not complete a call.
 * The synchronization engine reports it as a transient failure, so the message is redelivered.
 */
public class StoreUnavailableException extends RuntimeException {

    private final String storeName;

    public StoreUnavailableException(String storeName, String message) {
        this(storeName, message, null);
    }

    public StoreUnavailableException(String storeName, String message, Throwable cause) {
        super("[" + storeName + "] " + message, cause);
        this.storeName = storeName;
    }

    public String getStoreName() {
        return storeName;
    }
}
