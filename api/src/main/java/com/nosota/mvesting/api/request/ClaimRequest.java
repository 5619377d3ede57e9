package com.nosota.mvesting.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request for withdrawing vested tokens. The recipient is the caller.
 *
 * @param amount Amount to claim, must not exceed the currently claimable amount
 */
public record ClaimRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount
) {
}
