package com.nosota.mvesting.dto;

import com.nosota.mvesting.model.Recipient;

/**
 * A recipient valued at a clock reading. Locked and claimable are null for terminated recipients.
 */
public record RecipientValuation(
        Recipient recipient,
        Long lockedAmount,
        Long claimableAmount,
        boolean canClaim,
        long claimStartTime,
        long asOf
) {
}
