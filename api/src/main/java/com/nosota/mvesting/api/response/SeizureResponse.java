package com.nosota.mvesting.api.response;

import java.util.List;

/**
 * @param seizedAmount     Total swept to the safe address in this call
 * @param seizedAddresses  Recipients whose locked balance was seized in this call
 * @param skippedAddresses Recipients skipped because they were terminated or already seized
 * @param safeAddress      Destination of the sweep
 */
public record SeizureResponse(
        Long seizedAmount,
        List<String> seizedAddresses,
        List<String> skippedAddresses,
        String safeAddress
) {
}
