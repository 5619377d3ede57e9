package com.nosota.mvesting.service;

import com.nosota.mvesting.error.UnauthorizedException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessControlServiceTest {

    private static final String ADMIN = "0x" + "a".repeat(40);

    private final AccessControlService accessControlService =
            new AccessControlService(newPolicy());

    private static ConfiguredAdministratorPolicy newPolicy() {
        try {
            return new ConfiguredAdministratorPolicy("0x" + "A".repeat(40));
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    void acceptsTheAdministratorInAnyCase() throws Exception {
        assertThat(accessControlService.requireAdministrator("0x" + "A".repeat(40), "pause recipient"))
                .isEqualTo(ADMIN);
    }

    @Test
    void rejectsOtherCallers() {
        assertThatThrownBy(() -> accessControlService.requireAdministrator("0x" + "b".repeat(40), "pause recipient"))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessageContaining("not the administrator");
    }

    @Test
    void rejectsMissingOrMalformedCaller() {
        assertThatThrownBy(() -> accessControlService.requireAdministrator(null, "terminate escrow"))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessageContaining("terminate escrow");
        assertThatThrownBy(() -> accessControlService.requireAdministrator("admin", "terminate escrow"))
                .isInstanceOf(UnauthorizedException.class);
    }
}
