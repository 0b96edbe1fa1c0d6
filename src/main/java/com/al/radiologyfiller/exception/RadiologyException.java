package com.al.radiologyfiller.exception;

import lombok.Getter;

/**
 * Base class for every failure the order filler reports to its callers.
 */
@Getter
public abstract class RadiologyException extends RuntimeException {

    private final ErrorKind kind;

    protected RadiologyException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected RadiologyException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
