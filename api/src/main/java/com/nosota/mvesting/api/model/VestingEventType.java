package com.nosota.mvesting.api.model;

/**
 * Type of an entry in the vesting audit trail.
 */
public enum VestingEventType {
    FUNDS_RECEIVED,
    RECIPIENT_ADDED,
    PAUSED,
    UNPAUSED,
    RECIPIENT_TERMINATED,
    CLAIMED,
    ESCROW_TERMINATED,
    LOCKED_TOKENS_SEIZED,
    DUST_TRANSFERRED,
    SAFE_ADDRESS_UPDATED
}
