package com.nosota.mvesting.api.response;

/**
 * @param recipient       Recipient that claimed
 * @param amount          Amount transferred to the recipient
 * @param totalClaimed    Recipient's claimed total after the claim
 * @param claimableAmount What is still claimable after the claim
 * @param claimedAt       Clock reading of the claim
 */
public record ClaimResponse(
        String recipient,
        Long amount,
        Long totalClaimed,
        Long claimableAmount,
        Long claimedAt
) {
}
