package com.nosota.mvesting.api.response;

/**
 * Recipient schedule together with its valuation at {@code asOf}.
 *
 * @param address            Recipient address
 * @param status             UNPAUSED, PAUSED or TERMINATED
 * @param startTime          Vesting start (epoch seconds)
 * @param endTime            Vesting end, shifted by every pause
 * @param cliffDuration      Cliff length in seconds, shifted by every pause
 * @param lastPausedAt       Most recent pause instant, 0 if never paused
 * @param vestingPerSec      Fixed vesting rate
 * @param totalVestingAmount Total entitlement
 * @param totalClaimed       Amount withdrawn so far
 * @param seized             Whether the locked balance was swept after escrow termination
 * @param claimStartTime     {@code startTime + cliffDuration}
 * @param canClaim           Whether a claim is currently allowed
 * @param lockedAmount       Not yet vested amount, null for terminated recipients
 * @param claimableAmount    Vested but not yet claimed amount, null for terminated recipients
 * @param asOf               Clock reading used for the valuation
 */
public record RecipientResponse(
        String address,
        String status,
        Long startTime,
        Long endTime,
        Long cliffDuration,
        Long lastPausedAt,
        Long vestingPerSec,
        Long totalVestingAmount,
        Long totalClaimed,
        Boolean seized,
        Long claimStartTime,
        Boolean canClaim,
        Long lockedAmount,
        Long claimableAmount,
        Long asOf
) {
}
