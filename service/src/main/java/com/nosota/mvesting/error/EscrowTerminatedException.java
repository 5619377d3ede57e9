package com.nosota.mvesting.error;

/**
 * Operation requires an active escrow but the escrow has been terminated.
 */
public class EscrowTerminatedException extends VestingException {
    public EscrowTerminatedException(String message) {
        super(message);
    }

    public EscrowTerminatedException(String message, Throwable cause) {
        super(message, cause);
    }
}
