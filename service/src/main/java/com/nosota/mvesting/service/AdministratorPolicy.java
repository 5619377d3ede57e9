package com.nosota.mvesting.service;

/**
 * Authorization check for administrative vesting operations.
 */
public interface AdministratorPolicy {

    /**
     * @param caller Normalized caller address
     * @return true if the caller may invoke administrative operations
     */
    boolean isAdministrator(String caller);
}
