package com.nosota.mvesting.service;

import com.nosota.mvesting.error.InvalidAddressException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Single administrator configured with {@code vesting.administrator}.
 */
@Component
@Slf4j
public class ConfiguredAdministratorPolicy implements AdministratorPolicy {

    private final String administrator;

    public ConfiguredAdministratorPolicy(@Value("${vesting.administrator}") String administrator)
            throws InvalidAddressException {
        this.administrator = Addresses.normalize(administrator, "Administrator");
        log.info("Vesting administrator configured: {}", this.administrator);
    }

    @Override
    public boolean isAdministrator(String caller) {
        return administrator.equals(caller);
    }
}
