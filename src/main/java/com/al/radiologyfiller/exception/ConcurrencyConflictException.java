package com.al.radiologyfiller.exception;

/**
 * Raised when a contended key could not be locked in time or a concurrent writer won a race.
 * Callers retry the whole message; replay is idempotent.
 */
public class ConcurrencyConflictException extends RadiologyException {

    public ConcurrencyConflictException(String message) {
        super(ErrorKind.CONCURRENCY_CONFLICT, message);
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(ErrorKind.CONCURRENCY_CONFLICT, message, cause);
    }
}
