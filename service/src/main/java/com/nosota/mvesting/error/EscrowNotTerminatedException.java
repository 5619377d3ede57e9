package com.nosota.mvesting.error;

/**
 * Operation requires a terminated escrow.
 */
public class EscrowNotTerminatedException extends VestingException {
    public EscrowNotTerminatedException(String message) {
        super(message);
    }

    public EscrowNotTerminatedException(String message, Throwable cause) {
        super(message, cause);
    }
}
