package com.nosota.mvesting.controller;

import com.nosota.mvesting.api.VestingApi;
import com.nosota.mvesting.api.dto.PagedResponse;
import com.nosota.mvesting.api.dto.VestingEventDTO;
import com.nosota.mvesting.api.request.AddRecipientsRequest;
import com.nosota.mvesting.api.request.ClaimRequest;
import com.nosota.mvesting.api.request.SeizeLockedTokensRequest;
import com.nosota.mvesting.api.request.UpdateSafeAddressRequest;
import com.nosota.mvesting.api.response.*;
import com.nosota.mvesting.dto.*;
import com.nosota.mvesting.model.Escrow;
import com.nosota.mvesting.model.Recipient;
import com.nosota.mvesting.service.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the vesting escrow.
 *
 * <p>Implements {@link VestingApi}. Every state-changing endpoint delegates to a single
 * transactional service call; the response is built from what that call returned, or for
 * recipient status changes from a fresh valuation.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class VestingController implements VestingApi {

    private final AllocationService allocationService;
    private final RecipientLifecycleService recipientLifecycleService;
    private final EscrowTerminationService escrowTerminationService;
    private final VestingQueryService vestingQueryService;
    private final VestingEventService vestingEventService;
    private final EscrowService escrowService;
    private final TokenAccountLedger tokenAccountLedger;

    @Override
    public ResponseEntity<AddRecipientsResponse> addRecipients(String caller, AddRecipientsRequest request)
            throws Exception {
        log.info("Add recipients request: caller={}, count={}, totalFunding={}",
                caller, request.addresses().size(), request.totalFunding());

        AllocationResult result = allocationService.addRecipients(
                caller,
                request.addresses(),
                request.amounts(),
                request.startTimes(),
                request.endTimes(),
                request.cliffDurations(),
                request.totalFunding()
        );

        AddRecipientsResponse response = new AddRecipientsResponse(
                result.recipientCount(),
                result.totalFunding(),
                result.totalAllocated(),
                result.dustAdded()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    public ResponseEntity<RecipientResponse> pause(String caller, String address) throws Exception {
        log.info("Pause request: caller={}, recipient={}", caller, address);
        Recipient recipient = recipientLifecycleService.pause(caller, address);
        return ResponseEntity.ok(toRecipientResponse(vestingQueryService.getRecipientValuation(recipient.getAddress())));
    }

    @Override
    public ResponseEntity<RecipientResponse> unpause(String caller, String address) throws Exception {
        log.info("Unpause request: caller={}, recipient={}", caller, address);
        Recipient recipient = recipientLifecycleService.unpause(caller, address);
        return ResponseEntity.ok(toRecipientResponse(vestingQueryService.getRecipientValuation(recipient.getAddress())));
    }

    @Override
    public ResponseEntity<RecipientTerminationResponse> terminateRecipient(String caller, String address)
            throws Exception {
        log.info("Terminate recipient request: caller={}, recipient={}", caller, address);
        RecipientTermination termination = recipientLifecycleService.terminateRecipient(caller, address);

        RecipientTerminationResponse response = new RecipientTerminationResponse(
                termination.recipient(),
                termination.paidToRecipient(),
                termination.sweptToSafeAddress(),
                termination.safeAddress(),
                termination.terminatedAt()
        );
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<RecipientResponse> getRecipient(String address) throws Exception {
        return ResponseEntity.ok(toRecipientResponse(vestingQueryService.getRecipientValuation(address)));
    }

    @Override
    public ResponseEntity<ClaimResponse> claim(String caller, ClaimRequest request) throws Exception {
        log.info("Claim request: caller={}, amount={}", caller, request.amount());
        ClaimResult result = allocationService.claim(caller, request.amount());

        ClaimResponse response = new ClaimResponse(
                result.recipient(),
                result.amount(),
                result.totalClaimed(),
                result.remainingClaimable(),
                result.claimedAt()
        );
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<EscrowResponse> terminateEscrow(String caller) throws Exception {
        log.info("Terminate escrow request: caller={}", caller);
        Escrow escrow = escrowTerminationService.terminateEscrow(caller);
        return ResponseEntity.ok(toEscrowResponse(escrow));
    }

    @Override
    public ResponseEntity<SeizureResponse> seizeLockedTokens(String caller, SeizeLockedTokensRequest request)
            throws Exception {
        log.info("Seize locked tokens request: caller={}, addresses={}", caller, request.addresses().size());
        SeizureResult result = escrowTerminationService.seizeLockedTokens(caller, request.addresses());

        SeizureResponse response = new SeizureResponse(
                result.seizedAmount(),
                result.seizedAddresses(),
                result.skippedAddresses(),
                result.safeAddress()
        );
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<DustTransferResponse> transferDust(String caller) throws Exception {
        log.info("Transfer dust request: caller={}", caller);
        long amount = escrowTerminationService.transferDust(caller);
        return ResponseEntity.ok(new DustTransferResponse(amount, escrowService.getEscrow().getSafeAddress()));
    }

    @Override
    public ResponseEntity<EscrowResponse> updateSafeAddress(String caller, UpdateSafeAddressRequest request)
            throws Exception {
        log.info("Update safe address request: caller={}, safeAddress={}", caller, request.safeAddress());
        Escrow escrow = escrowTerminationService.updateSafeAddress(caller, request.safeAddress());
        return ResponseEntity.ok(toEscrowResponse(escrow));
    }

    @Override
    public ResponseEntity<EscrowResponse> getEscrow() {
        return ResponseEntity.ok(toEscrowResponse(escrowService.getEscrow()));
    }

    @Override
    public ResponseEntity<PagedResponse<VestingEventDTO>> getEvents(String recipient, int page, int size) {
        return ResponseEntity.ok(vestingEventService.getEvents(recipient, page, size));
    }

    private RecipientResponse toRecipientResponse(RecipientValuation valuation) {
        Recipient recipient = valuation.recipient();
        return new RecipientResponse(
                recipient.getAddress(),
                recipient.getStatus().name(),
                recipient.getStartTime(),
                recipient.getEndTime(),
                recipient.getCliffDuration(),
                recipient.getLastPausedAt(),
                recipient.getVestingPerSec(),
                recipient.getTotalVestingAmount(),
                recipient.getTotalClaimed(),
                recipient.isSeized(),
                valuation.claimStartTime(),
                valuation.canClaim(),
                valuation.lockedAmount(),
                valuation.claimableAmount(),
                valuation.asOf()
        );
    }

    private EscrowResponse toEscrowResponse(Escrow escrow) {
        return new EscrowResponse(
                escrow.getStatus().name(),
                escrow.getTerminatedAt(),
                escrow.getSafeAddress(),
                escrow.getEscrowAddress(),
                tokenAccountLedger.balanceOf(escrow.getEscrowAddress()),
                escrow.getTotalAllocatedSupply(),
                escrow.getTotalClaimed(),
                escrow.getTotalSeized(),
                escrow.getDust()
        );
    }
}
