package com.nosota.mvesting.service;

import com.nosota.mvesting.error.InvalidAddressException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Address parsing shared by the services. Addresses are 0x-prefixed 20-byte hex strings,
 * stored lower-case.
 */
public final class Addresses {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private Addresses() {
    }

    /**
     * Validates and normalizes an address.
     *
     * @param address Raw address
     * @param role    What the address is used for, included in the error message
     * @return Lower-case address
     * @throws InvalidAddressException if the address is missing, malformed or zero
     */
    public static String normalize(String address, String role) throws InvalidAddressException {
        if (address == null || address.isBlank()) {
            throw new InvalidAddressException(role + " address is required");
        }
        String trimmed = address.trim();
        if (!ADDRESS_PATTERN.matcher(trimmed).matches()) {
            throw new InvalidAddressException(role + " address is malformed: " + address);
        }
        String normalized = trimmed.toLowerCase(Locale.ROOT);
        if (ZERO_ADDRESS.equals(normalized)) {
            throw new InvalidAddressException(role + " address must not be the zero address");
        }
        return normalized;
    }
}
