package com.nosota.mvesting.error;

/**
 * Base class of all rejections raised by the vesting engine.
 *
 * <p>Every subclass names one failed precondition. A rejected operation leaves no partial
 * effect: service methods run in a transaction rolled back on any exception.
 */
public abstract class VestingException extends Exception {
    protected VestingException(String message) {
        super(message);
    }

    protected VestingException(String message, Throwable cause) {
        super(message, cause);
    }
}
