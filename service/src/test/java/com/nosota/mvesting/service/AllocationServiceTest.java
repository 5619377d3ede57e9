package com.nosota.mvesting.service;

import com.nosota.mvesting.api.model.RecipientStatus;
import com.nosota.mvesting.api.model.VestingEventType;
import com.nosota.mvesting.dto.AllocationResult;
import com.nosota.mvesting.dto.ClaimResult;
import com.nosota.mvesting.error.*;
import com.nosota.mvesting.model.Recipient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class AllocationServiceTest extends VestingServiceTestSupport {

    @Test
    @DisplayName("A funded batch creates unpaused recipients and books the unassigned funding as dust")
    void addRecipientsBooksBatch() throws Exception {
        AllocationResult result = allocationService.addRecipients(ADMIN,
                List.of(ALICE, BOB),
                List.of(1000L, 500L),
                List.of(T, T + 50),
                List.of(T + 1000, T + 550),
                List.of(100L, 0L),
                1600L);

        assertThat(result.recipientCount()).isEqualTo(2);
        assertThat(result.totalAllocated()).isEqualTo(1500L);
        assertThat(result.dustAdded()).isEqualTo(100L);

        assertThat(escrow.getTotalAllocatedSupply()).isEqualTo(1500L);
        assertThat(escrow.getDust()).isEqualTo(100L);

        Recipient alice = recipients.get(ALICE);
        assertThat(alice.getStatus()).isEqualTo(RecipientStatus.UNPAUSED);
        assertThat(alice.getVestingPerSec()).isEqualTo(1L);
        assertThat(alice.getTotalClaimed()).isZero();
        assertThat(recipients.get(BOB).getVestingPerSec()).isEqualTo(1L);

        verify(tokenLedger).pull(ADMIN, 1600L);
        verify(vestingEventService).record(VestingEventType.FUNDS_RECEIVED, null, ADMIN, 1600L, T - 100);
        verify(vestingEventService, times(2)).record(eq(VestingEventType.RECIPIENT_ADDED), anyString(), isNull(),
                anyLong(), eq(T - 100));
    }

    @Test
    void addRecipientsRequiresAdministrator() {
        assertThatThrownBy(this::addStrangerBatch)
                .isInstanceOf(UnauthorizedException.class);

        verify(escrowService, never()).lockEscrow();
        verifyNoInteractions(tokenLedger);
    }

    @Test
    void addRecipientsRejectedAfterEscrowTermination() throws Exception {
        escrow.terminate(T - 100);

        assertThatThrownBy(() -> addStandardRecipient(ALICE))
                .isInstanceOf(EscrowTerminatedException.class);
        verifyNoInteractions(tokenLedger);
    }

    @Test
    void addRecipientsRejectsMismatchedLists() {
        assertThatThrownBy(() -> allocationService.addRecipients(ADMIN,
                List.of(ALICE, BOB), List.of(1000L), List.of(T, T), List.of(T + 1000, T + 1000),
                List.of(0L, 0L), 2000L))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("equal lengths");
        verifyNoInteractions(tokenLedger);
    }

    @Test
    void addRecipientsRejectsInvalidSchedules() {
        assertThatThrownBy(() -> allocationService.addRecipients(ADMIN,
                List.of(ALICE), List.of(1000L), List.of(T - 200), List.of(T + 1000), List.of(0L), 1000L))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("not in the future");

        assertThatThrownBy(() -> allocationService.addRecipients(ADMIN,
                List.of(ALICE), List.of(1000L), List.of(T), List.of(T), List.of(0L), 1000L))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("must be after start time");

        assertThatThrownBy(() -> allocationService.addRecipients(ADMIN,
                List.of(ALICE), List.of(1000L), List.of(T), List.of(T + 100), List.of(100L), 1000L))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("cliff duration");

        assertThatThrownBy(() -> allocationService.addRecipients(ADMIN,
                List.of(ALICE), List.of(0L), List.of(T), List.of(T + 1000), List.of(0L), 1000L))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("amount must be positive");

        assertThat(recipients).isEmpty();
        verifyNoInteractions(tokenLedger);
    }

    @Test
    void addRecipientsAcceptsPastStartWhenConfigured() throws Exception {
        ReflectionTestUtils.setField(allocationService, "allowPastStartTime", true);

        allocationService.addRecipients(ADMIN,
                List.of(ALICE), List.of(1000L), List.of(T - 500), List.of(T + 500), List.of(0L), 1000L);

        assertThat(recipients).containsKey(ALICE);
    }

    @Test
    void addRecipientsRejectsZeroAddress() {
        assertThatThrownBy(() -> allocationService.addRecipients(ADMIN,
                List.of(Addresses.ZERO_ADDRESS), List.of(1000L), List.of(T), List.of(T + 1000), List.of(0L), 1000L))
                .isInstanceOf(InvalidAddressException.class);
    }

    @Test
    @DisplayName("Duplicate recipients are rejected, within the batch and against stored recipients")
    void addRecipientsRejectsDuplicates() throws Exception {
        assertThatThrownBy(() -> allocationService.addRecipients(ADMIN,
                List.of(ALICE, ALICE), List.of(100L, 100L), List.of(T, T), List.of(T + 1000, T + 1000),
                List.of(0L, 0L), 200L))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("listed twice");

        addStandardRecipient(ALICE);
        clearInvocations(tokenLedger);

        assertThatThrownBy(() -> addStandardRecipient(ALICE))
                .isInstanceOf(StateConflictException.class)
                .hasMessageContaining(ALICE);
        verifyNoInteractions(tokenLedger);
        assertThat(escrow.getTotalAllocatedSupply()).isEqualTo(1000L);
    }

    @Test
    void addRecipientsRejectsUnderfundedBatch() {
        assertThatThrownBy(() -> allocationService.addRecipients(ADMIN,
                List.of(ALICE), List.of(1000L), List.of(T), List.of(T + 1000), List.of(100L), 999L))
                .isInstanceOf(InsufficientFundsException.class);
        assertThat(escrow.getTotalAllocatedSupply()).isZero();
    }

    @Test
    void addRecipientsPropagatesFailedPull() throws Exception {
        doThrow(new InsufficientFundsException("Insufficient allowance"))
                .when(tokenLedger).pull(ADMIN, 1000L);

        assertThatThrownBy(() -> addStandardRecipient(ALICE))
                .isInstanceOf(InsufficientFundsException.class);
        assertThat(recipients).isEmpty();
        assertThat(escrow.getTotalAllocatedSupply()).isZero();
    }

    @Test
    @DisplayName("Claims follow the linear schedule and pay the caller")
    void claimPaysVestedAmount() throws Exception {
        addStandardRecipient(ALICE);

        advanceTo(T + 600);
        ClaimResult first = allocationService.claim(ALICE, 250L);

        assertThat(first.amount()).isEqualTo(250L);
        assertThat(first.totalClaimed()).isEqualTo(250L);
        assertThat(first.remainingClaimable()).isEqualTo(350L);
        verify(tokenLedger).push(ALICE, 250L);

        advanceTo(T + 1000);
        ClaimResult last = allocationService.claim(ALICE, 750L);

        assertThat(last.totalClaimed()).isEqualTo(1000L);
        assertThat(last.remainingClaimable()).isZero();
        assertThat(escrow.getTotalClaimed()).isEqualTo(1000L);
        assertThat(recipients.get(ALICE).getTotalClaimed()).isEqualTo(1000L);
    }

    @Test
    void claimRejectsAmountAboveClaimable() throws Exception {
        addStandardRecipient(ALICE);
        advanceTo(T + 600);

        assertThatThrownBy(() -> allocationService.claim(ALICE, 601L))
                .isInstanceOf(ClaimExceedsEntitlementException.class)
                .hasMessageContaining("claimable=600");
        verify(tokenLedger, never()).push(anyString(), anyLong());
    }

    @Test
    void claimRejectedBeforeCliff() throws Exception {
        addStandardRecipient(ALICE);
        advanceTo(T + 99);

        assertThatThrownBy(() -> allocationService.claim(ALICE, 1L))
                .isInstanceOf(ClaimExceedsEntitlementException.class)
                .hasMessageContaining("Cliff not reached");
    }

    @Test
    void claimRejectedWhilePaused() throws Exception {
        addStandardRecipient(ALICE);
        advanceTo(T + 300);
        recipientLifecycleService.pause(ADMIN, ALICE);

        assertThatThrownBy(() -> allocationService.claim(ALICE, 1L))
                .isInstanceOf(StateConflictException.class)
                .hasMessageContaining("PAUSED");
    }

    @Test
    void claimRejectsUnknownCallerAndNonPositiveAmounts() throws Exception {
        addStandardRecipient(ALICE);
        advanceTo(T + 600);

        assertThatThrownBy(() -> allocationService.claim(STRANGER, 1L))
                .isInstanceOf(RecipientNotFoundException.class);
        assertThatThrownBy(() -> allocationService.claim(ALICE, 0L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> allocationService.claim(ALICE, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("After escrow termination recipients keep what had vested before it")
    void claimAfterEscrowTermination() throws Exception {
        addStandardRecipient(ALICE);
        advanceTo(T + 500);
        escrowTerminationService.terminateEscrow(ADMIN);

        advanceTo(T + 900);
        assertThatThrownBy(() -> allocationService.claim(ALICE, 501L))
                .isInstanceOf(ClaimExceedsEntitlementException.class);

        ClaimResult result = allocationService.claim(ALICE, 500L);
        assertThat(result.totalClaimed()).isEqualTo(500L);
        assertThat(result.remainingClaimable()).isZero();
    }

    private void addStrangerBatch() throws Exception {
        allocationService.addRecipients(STRANGER,
                List.of(ALICE), List.of(1000L), List.of(T), List.of(T + 1000), List.of(100L), 1000L);
    }
}
