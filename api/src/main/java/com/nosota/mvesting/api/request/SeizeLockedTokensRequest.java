package com.nosota.mvesting.api.request;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request for sweeping the locked balances of the given recipients to the safe address
 * after the escrow has been terminated.
 *
 * @param addresses Recipient addresses; already seized or terminated recipients are skipped
 */
public record SeizeLockedTokensRequest(
        @NotEmpty(message = "At least one address is required")
        List<String> addresses
) {
}
