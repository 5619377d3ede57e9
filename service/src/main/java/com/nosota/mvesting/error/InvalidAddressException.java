package com.nosota.mvesting.error;

/**
 * Address is missing, malformed or the zero address.
 */
public class InvalidAddressException extends VestingException {
    public InvalidAddressException(String message) {
        super(message);
    }

    public InvalidAddressException(String message, Throwable cause) {
        super(message, cause);
    }
}
