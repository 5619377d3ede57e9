package com.nosota.mvesting.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request for setting the amount the escrow may pull from a token account.
 *
 * @param allowance New allowance, replaces the previous one
 */
public record TokenApproveRequest(
        @NotNull(message = "Allowance is required")
        @PositiveOrZero(message = "Allowance must not be negative")
        Long allowance
) {
}
