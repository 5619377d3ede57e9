package com.nosota.mvesting.error;

/**
 * Requested transition is not valid from the recipient's current status.
 */
public class StateConflictException extends VestingException {
    public StateConflictException(String message) {
        super(message);
    }

    public StateConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
