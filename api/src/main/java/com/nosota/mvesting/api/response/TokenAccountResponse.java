package com.nosota.mvesting.api.response;

/**
 * @param address   Account address
 * @param balance   Token balance
 * @param allowance Amount the escrow may pull from this account
 */
public record TokenAccountResponse(
        String address,
        Long balance,
        Long allowance
) {
}
