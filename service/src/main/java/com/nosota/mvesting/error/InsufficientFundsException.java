package com.nosota.mvesting.error;

/**
 * Token ledger could not move funds: balance or allowance too low.
 */
public class InsufficientFundsException extends VestingException {
    public InsufficientFundsException(String message) {
        super(message);
    }

    public InsufficientFundsException(String message, Throwable cause) {
        super(message, cause);
    }
}
