package com.nosota.mvesting.dto;

/**
 * @param recipient          Claiming recipient
 * @param amount             Amount paid out
 * @param totalClaimed       Recipient total after the claim
 * @param remainingClaimable Claimable amount left after the claim
 * @param claimedAt          Clock reading
 */
public record ClaimResult(
        String recipient,
        long amount,
        long totalClaimed,
        long remainingClaimable,
        long claimedAt
) {
}
