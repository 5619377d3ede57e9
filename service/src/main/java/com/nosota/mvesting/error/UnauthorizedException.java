package com.nosota.mvesting.error;

/**
 * Caller is not allowed to invoke the operation.
 */
public class UnauthorizedException extends VestingException {
    public UnauthorizedException(String message) {
        super(message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(message, cause);
    }
}
