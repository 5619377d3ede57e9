package com.nosota.mvesting.api.response;

/**
 * @param amount      Dust swept, 0 if there was none
 * @param safeAddress Destination of the sweep
 */
public record DustTransferResponse(
        Long amount,
        String safeAddress
) {
}
