package com.nosota.mvesting.controller;

import com.nosota.mvesting.TestBase;
import com.nosota.mvesting.api.VestingApi;
import com.nosota.mvesting.api.request.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.ResultActions;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class VestingControllerTest extends TestBase {

    private static final String ALICE = "0x" + "1".repeat(40);
    private static final String BOB = "0x" + "2".repeat(40);

    @Test
    @DisplayName("Fund, vest, claim, terminate the escrow and seize the frozen balances")
    void fullLifecycle() throws Exception {
        fundAdministrator(2000L);

        addRecipients(new AddRecipientsRequest(
                List.of(ALICE, BOB),
                List.of(1000L, 1000L),
                List.of(T, T),
                List.of(T + 1000, T + 1000),
                List.of(100L, 100L),
                2000L))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.recipientCount").value(2))
                .andExpect(jsonPath("$.dustAdded").value(0));

        advanceTo(T + 600);
        mockMvc.perform(get("/api/v1/vesting/recipients/{address}", ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UNPAUSED"))
                .andExpect(jsonPath("$.vestingPerSec").value(1))
                .andExpect(jsonPath("$.lockedAmount").value(400))
                .andExpect(jsonPath("$.claimableAmount").value(600))
                .andExpect(jsonPath("$.canClaim").value(true));

        mockMvc.perform(post("/api/v1/vesting/claims")
                        .header(VestingApi.CALLER_HEADER, ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ClaimRequest(600L))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalClaimed").value(600))
                .andExpect(jsonPath("$.claimableAmount").value(0));

        mockMvc.perform(get("/api/v1/tokens/{address}", ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(600));

        mockMvc.perform(post("/api/v1/vesting/escrow/terminate").header(VestingApi.CALLER_HEADER, ADMIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("TERMINATED"))
                .andExpect(jsonPath("$.terminatedAt").value(T + 600));

        advanceTo(T + 900);
        mockMvc.perform(post("/api/v1/vesting/escrow/seize")
                        .header(VestingApi.CALLER_HEADER, ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new SeizeLockedTokensRequest(List.of(ALICE, BOB)))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.seizedAmount").value(800))
                .andExpect(jsonPath("$.seizedAddresses", hasSize(2)));

        mockMvc.perform(get("/api/v1/vesting/escrow"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAllocatedSupply").value(2000))
                .andExpect(jsonPath("$.totalClaimed").value(600))
                .andExpect(jsonPath("$.totalSeized").value(800))
                .andExpect(jsonPath("$.escrowBalance").value(600));

        mockMvc.perform(get("/api/v1/tokens/{address}", SAFE))
                .andExpect(jsonPath("$.balance").value(800));

        mockMvc.perform(get("/api/v1/vesting/events").param("recipient", ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRecords").value(3))
                .andExpect(jsonPath("$.data[0].type").value("LOCKED_TOKENS_SEIZED"));
    }

    @Test
    @DisplayName("A failed token pull leaves no recipient and no accounting behind")
    void failedFundingRollsBack() throws Exception {
        mockMvc.perform(post("/api/v1/tokens/{address}/deposit", ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new TokenDepositRequest(1000L, "mint-1"))))
                .andExpect(status().isOk());

        addRecipients(new AddRecipientsRequest(
                List.of(ALICE), List.of(1000L), List.of(T), List.of(T + 1000), List.of(100L), 1000L))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("Insufficient Funds"));

        mockMvc.perform(get("/api/v1/vesting/recipients/{address}", ALICE))
                .andExpect(status().isNotFound());

        Integer recipientCount = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM recipient", Integer.class);
        Integer eventCount = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM vesting_event", Integer.class);
        assertThat(recipientCount).isZero();
        assertThat(eventCount).isZero();

        mockMvc.perform(get("/api/v1/tokens/{address}", ADMIN))
                .andExpect(jsonPath("$.balance").value(1000));
    }

    @Test
    void underfundedBatchRollsBackThePull() throws Exception {
        fundAdministrator(999L);

        addRecipients(new AddRecipientsRequest(
                List.of(ALICE), List.of(1000L), List.of(T), List.of(T + 1000), List.of(100L), 999L))
                .andExpect(status().isUnprocessableEntity());

        mockMvc.perform(get("/api/v1/tokens/{address}", ADMIN))
                .andExpect(jsonPath("$.balance").value(999))
                .andExpect(jsonPath("$.allowance").value(999));
        mockMvc.perform(get("/api/v1/tokens/{address}", ESCROW))
                .andExpect(jsonPath("$.balance").value(0));
    }

    @Test
    void administrativeOperationsRejectOtherCallers() throws Exception {
        mockMvc.perform(post("/api/v1/vesting/escrow/terminate").header(VestingApi.CALLER_HEADER, ALICE))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("Unauthorized"));

        mockMvc.perform(post("/api/v1/vesting/escrow/terminate"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/v1/vesting/escrow"))
                .andExpect(jsonPath("$.status").value("ACTIVE"));
    }

    @Test
    void pauseUnpauseAndTerminateRecipient() throws Exception {
        fundAdministrator(1000L);
        addRecipients(new AddRecipientsRequest(
                List.of(ALICE), List.of(1000L), List.of(T), List.of(T + 1000), List.of(100L), 1000L))
                .andExpect(status().isCreated());

        advanceTo(T + 600);
        mockMvc.perform(post("/api/v1/vesting/recipients/{address}/pause", ALICE)
                        .header(VestingApi.CALLER_HEADER, ADMIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PAUSED"))
                .andExpect(jsonPath("$.canClaim").value(false));

        mockMvc.perform(post("/api/v1/vesting/recipients/{address}/pause", ALICE)
                        .header(VestingApi.CALLER_HEADER, ADMIN))
                .andExpect(status().isConflict());

        advanceTo(T + 700);
        mockMvc.perform(post("/api/v1/vesting/recipients/{address}/unpause", ALICE)
                        .header(VestingApi.CALLER_HEADER, ADMIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.endTime").value(T + 1100))
                .andExpect(jsonPath("$.cliffDuration").value(200))
                .andExpect(jsonPath("$.lockedAmount").value(400));

        mockMvc.perform(post("/api/v1/vesting/recipients/{address}/terminate", ALICE)
                        .header(VestingApi.CALLER_HEADER, ADMIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paidToRecipient").value(600))
                .andExpect(jsonPath("$.sweptToSafeAddress").value(400))
                .andExpect(jsonPath("$.safeAddress").value(SAFE));

        mockMvc.perform(post("/api/v1/vesting/claims")
                        .header(VestingApi.CALLER_HEADER, ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ClaimRequest(1L))))
                .andExpect(status().isConflict());

        mockMvc.perform(get("/api/v1/vesting/recipients/{address}", ALICE))
                .andExpect(jsonPath("$.status").value("TERMINATED"))
                .andExpect(jsonPath("$.lockedAmount").doesNotExist());
    }

    @Test
    void invalidRequestsAreRejected() throws Exception {
        addRecipients(new AddRecipientsRequest(List.of(), List.of(), List.of(), List.of(), List.of(), 0L))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"));

        mockMvc.perform(put("/api/v1/vesting/escrow/safe-address")
                        .header(VestingApi.CALLER_HEADER, ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new UpdateSafeAddressRequest("0x1234"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Address"));

        mockMvc.perform(get("/api/v1/vesting/recipients/{address}", ALICE))
                .andExpect(status().isNotFound());
    }

    private void fundAdministrator(long amount) throws Exception {
        mockMvc.perform(post("/api/v1/tokens/{address}/deposit", ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new TokenDepositRequest(amount, "mint"))))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/v1/tokens/{address}/approve", ADMIN)
                        .header(VestingApi.CALLER_HEADER, ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new TokenApproveRequest(amount))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowance").value(amount));
    }

    private ResultActions addRecipients(AddRecipientsRequest request) throws Exception {
        return mockMvc.perform(post("/api/v1/vesting/recipients")
                .header(VestingApi.CALLER_HEADER, ADMIN)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)));
    }
}
