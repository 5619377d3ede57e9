package com.nosota.mvesting.service;

import com.nosota.mvesting.dto.RecipientValuation;
import com.nosota.mvesting.error.InvalidAddressException;
import com.nosota.mvesting.error.RecipientNotFoundException;
import com.nosota.mvesting.error.StateConflictException;
import com.nosota.mvesting.model.Escrow;
import com.nosota.mvesting.model.Recipient;
import com.nosota.mvesting.repository.RecipientRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read side of the vesting engine: recipient lookup and valuation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VestingQueryService {

    private final RecipientRepository recipientRepository;
    private final EscrowService escrowService;
    private final VestingScheduleCalculator scheduleCalculator;
    private final RecipientStatusStateMachine statusStateMachine;
    private final VestingClock vestingClock;

    /**
     * @param address Normalized address
     * @throws RecipientNotFoundException if no recipient is registered under the address
     */
    public Recipient requireRecipient(String address) throws RecipientNotFoundException {
        return recipientRepository.findById(address)
                .orElseThrow(() -> new RecipientNotFoundException("Recipient not found: " + address));
    }

    /**
     * Values a recipient at the current clock reading.
     * Terminated recipients are returned without locked and claimable amounts.
     */
    @Transactional(readOnly = true)
    public RecipientValuation getRecipientValuation(String rawAddress)
            throws InvalidAddressException, RecipientNotFoundException, StateConflictException {
        String address = Addresses.normalize(rawAddress, "Recipient");
        long now = vestingClock.now();
        Recipient recipient = requireRecipient(address);
        Escrow escrow = escrowService.getEscrow();

        long claimStartTime = scheduleCalculator.claimStartTime(recipient);
        if (statusStateMachine.isFinalState(recipient.getStatus())) {
            log.debug("Valued terminated recipient: address={}", address);
            return new RecipientValuation(recipient, null, null, false, claimStartTime, now);
        }

        long locked = scheduleCalculator.lockedAmount(recipient, escrow, now);
        long claimable = scheduleCalculator.claimableAmount(recipient, escrow, now);
        boolean canClaim = scheduleCalculator.canClaim(recipient, now);

        log.debug("Valued recipient: address={}, locked={}, claimable={}, canClaim={}, asOf={}",
                address, locked, claimable, canClaim, now);
        return new RecipientValuation(recipient, locked, claimable, canClaim, claimStartTime, now);
    }
}
