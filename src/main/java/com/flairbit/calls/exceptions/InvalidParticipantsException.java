package com.flairbit.calls.exceptions;

/**
 * Raised when a call is requested between unknown or ineligible participants.
 */
public class InvalidParticipantsException extends RuntimeException {
    public InvalidParticipantsException(String message) {
        super(message);
    }
}
