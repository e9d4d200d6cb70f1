package com.github.errfix;

/**
 * The single error a run of errfix fails with, carrying the underlying cause.
 */
public class ErrFixException extends Exception {

    public ErrFixException(String message) {
        super(message);
    }

    public ErrFixException(String message, Throwable cause) {
        super(message, cause);
    }
}
