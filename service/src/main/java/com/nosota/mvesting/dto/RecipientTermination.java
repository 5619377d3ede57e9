package com.nosota.mvesting.dto;

/**
 * Fund split of an individual recipient termination.
 *
 * @param recipient          Terminated recipient
 * @param paidToRecipient    Claimable amount paid out
 * @param sweptToSafeAddress Rest of the entitlement sent to the safe address
 * @param safeAddress        Sweep destination
 * @param terminatedAt       Clock reading
 */
public record RecipientTermination(
        String recipient,
        long paidToRecipient,
        long sweptToSafeAddress,
        String safeAddress,
        long terminatedAt
) {
}
