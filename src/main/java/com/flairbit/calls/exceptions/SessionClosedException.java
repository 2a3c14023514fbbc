package com.flairbit.calls.exceptions;

/**
 * Raised when an operation targets a call session that already reached a terminal state.
 */
public class SessionClosedException extends RuntimeException {
    public SessionClosedException(String message) {
        super(message);
    }
}
