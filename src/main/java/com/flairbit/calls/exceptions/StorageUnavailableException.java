package com.flairbit.calls.exceptions;

/**
 * Transient failure of a backing store (segment storage or the audit trail).
 * Retried internally where the operation allows it.
 */
public class StorageUnavailableException extends RuntimeException {
    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
