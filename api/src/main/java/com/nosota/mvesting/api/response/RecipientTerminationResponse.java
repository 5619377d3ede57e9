package com.nosota.mvesting.api.response;

/**
 * @param recipient          Terminated recipient
 * @param paidToRecipient    Claimable amount paid out on termination
 * @param sweptToSafeAddress Remaining entitlement sent to the safe address
 * @param safeAddress        Destination of the sweep
 * @param terminatedAt       Clock reading of the termination
 */
public record RecipientTerminationResponse(
        String recipient,
        Long paidToRecipient,
        Long sweptToSafeAddress,
        String safeAddress,
        Long terminatedAt
) {
}
