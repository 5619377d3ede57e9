package com.nosota.mvesting.service;

import com.nosota.mvesting.error.InvalidAddressException;
import com.nosota.mvesting.error.UnauthorizedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Gate in front of every administrative vesting operation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessControlService {

    private final AdministratorPolicy administratorPolicy;

    /**
     * Normalizes the caller and checks it against the administrator policy.
     *
     * @param caller    Raw caller address
     * @param operation Operation name, for the error message
     * @return Normalized caller address
     * @throws UnauthorizedException if the caller is missing, malformed or not the administrator
     */
    public String requireAdministrator(String caller, String operation) throws UnauthorizedException {
        String normalized;
        try {
            normalized = Addresses.normalize(caller, "Caller");
        } catch (InvalidAddressException e) {
            throw new UnauthorizedException("Cannot " + operation + ": " + e.getMessage(), e);
        }
        if (!administratorPolicy.isAdministrator(normalized)) {
            log.warn("Rejected administrative operation: operation={}, caller={}", operation, normalized);
            throw new UnauthorizedException("Cannot " + operation + ": caller " + normalized + " is not the administrator");
        }
        return normalized;
    }
}
