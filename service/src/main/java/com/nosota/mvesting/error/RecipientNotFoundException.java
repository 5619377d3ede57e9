package com.nosota.mvesting.error;

/**
 * No recipient is registered under the given address.
 */
public class RecipientNotFoundException extends VestingException {
    public RecipientNotFoundException(String message) {
        super(message);
    }

    public RecipientNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
