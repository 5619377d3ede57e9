package com.nosota.mvesting.api.model;

/**
 * Global status of the vesting escrow. Transitions only forward: ACTIVE → TERMINATED.
 */
public enum EscrowStatus {
    /**
     * Recipients can be added, paused, unpaused and terminated.
     */
    ACTIVE,

    /**
     * Vesting of unpaused recipients is frozen at {@code terminatedAt}.
     * Recipients may still claim what had vested; locked balances can be seized.
     * This is a final state.
     */
    TERMINATED
}
