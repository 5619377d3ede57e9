package com.nosota.mvesting.api.model;

/**
 * Lifecycle status of a vesting recipient.
 *
 * <p><b>Lifecycle:</b>
 * <pre>
 * UNPAUSED ⇄ PAUSED
 *     \       /
 *    TERMINATED
 * </pre>
 */
public enum RecipientStatus {
    /**
     * Initial state. Vesting progresses with time and claims are allowed after the cliff.
     */
    UNPAUSED,

    /**
     * Vesting progress is frozen at {@code lastPausedAt}. No claims.
     * On unpause the paused duration is added to the cliff and the end time.
     */
    PAUSED,

    /**
     * Final state. Claimable amount was paid out and the locked rest swept to the safe address.
     * The record is immutable from here on.
     */
    TERMINATED
}
