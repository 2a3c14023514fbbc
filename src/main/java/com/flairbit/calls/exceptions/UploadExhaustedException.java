package com.flairbit.calls.exceptions;

public class UploadExhaustedException extends RuntimeException {
    public UploadExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
