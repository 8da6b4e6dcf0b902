package com.example.ordersync.application.service;

import com.example.ordersync.domain.exception.DomainException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failed message should be redelivered.
 * Domain failures carry their own flag; anything unclassified is assumed transient.
 */
public final class SyncFailureClassifier {

    private SyncFailureClassifier() {
    }

    public static boolean isTransient(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof DomainException) {
            return ((DomainException) cause).isTransient();
        }
        return true;
    }

    public static String errorCode(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof DomainException) {
            return ((DomainException) cause).getErrorCode();
        }
        if (cause instanceof TimeoutException) {
            return "TIMEOUT";
        }
        return cause.getClass().getSimpleName();
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
