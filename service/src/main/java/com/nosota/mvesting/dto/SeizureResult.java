package com.nosota.mvesting.dto;

import java.util.List;

/**
 * @param seizedAmount     Total swept in this call
 * @param seizedAddresses  Recipients seized in this call
 * @param skippedAddresses Recipients skipped (terminated or already seized)
 * @param safeAddress      Sweep destination
 */
public record SeizureResult(
        long seizedAmount,
        List<String> seizedAddresses,
        List<String> skippedAddresses,
        String safeAddress
) {
}
