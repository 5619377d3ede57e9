package com.nosota.mvesting.error;

/**
 * Schedule or batch parameters are inconsistent (start not in the future, end not after start, cliff too long, zero amount, mismatched lists).
 */
public class InvalidScheduleException extends VestingException {
    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
