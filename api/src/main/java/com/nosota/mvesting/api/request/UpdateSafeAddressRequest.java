package com.nosota.mvesting.api.request;

import jakarta.validation.constraints.NotBlank;

/**
 * @param safeAddress New destination for seized funds and dust
 */
public record UpdateSafeAddressRequest(
        @NotBlank(message = "Safe address is required")
        String safeAddress
) {
}
