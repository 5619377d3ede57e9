package com.nosota.mvesting.error;

/**
 * Claim exceeds the claimable amount or would push claimed totals past their caps.
 */
public class ClaimExceedsEntitlementException extends VestingException {
    public ClaimExceedsEntitlementException(String message) {
        super(message);
    }

    public ClaimExceedsEntitlementException(String message, Throwable cause) {
        super(message, cause);
    }
}
