package com.nosota.mvesting.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request for crediting a token account from an external source.
 *
 * @param amount            Amount to credit
 * @param externalReference External reference (e.g. bridge or exchange transfer id)
 */
public record TokenDepositRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount,

        String externalReference
) {
}
