package com.nosota.mvesting.service;

import com.nosota.mvesting.api.model.RecipientStatus;
import com.nosota.mvesting.api.model.VestingEventType;
import com.nosota.mvesting.dto.RecipientTermination;
import com.nosota.mvesting.error.VestingException;
import com.nosota.mvesting.model.Escrow;
import com.nosota.mvesting.model.Recipient;
import com.nosota.mvesting.repository.RecipientRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Administrative status changes of individual recipients.
 *
 * <p>Pausing freezes a recipient's progress at the pause instant. Unpausing adds the
 * paused duration to both the cliff and the end time, so with the unchanged
 * {@code vestingPerSec} the recipient resumes exactly where it stopped:
 * <pre>
 *   pause at T1, unpause at T2:
 *     cliffDuration += T2 - T1
 *     endTime       += T2 - T1
 *     locked(T2 after unpause) == locked(T1 before pause)
 * </pre>
 * There is no limit on the number of pause cycles.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecipientLifecycleService {

    private final RecipientRepository recipientRepository;
    private final EscrowService escrowService;
    private final VestingQueryService vestingQueryService;
    private final VestingScheduleCalculator scheduleCalculator;
    private final RecipientStatusStateMachine statusStateMachine;
    private final AccessControlService accessControlService;
    private final VestingEventService vestingEventService;
    private final TokenLedger tokenLedger;
    private final VestingClock vestingClock;

    /**
     * Freezes the recipient at the current instant.
     *
     * @param caller  Administrator address
     * @param address Recipient address
     * @return The paused recipient
     */
    @Transactional(rollbackFor = Exception.class)
    public Recipient pause(String caller, String address) throws VestingException {
        accessControlService.requireAdministrator(caller, "pause recipient");
        String recipientAddress = Addresses.normalize(address, "Recipient");
        long now = vestingClock.now();
        Escrow escrow = escrowService.lockEscrow();
        escrow.requireActive("pause recipient");

        Recipient recipient = vestingQueryService.requireRecipient(recipientAddress);
        statusStateMachine.validateTransition(recipientAddress, recipient.getStatus(), RecipientStatus.PAUSED);

        recipient.setStatus(RecipientStatus.PAUSED);
        recipient.setLastPausedAt(now);
        recipient.setUpdatedAt(LocalDateTime.now());
        recipientRepository.save(recipient);
        vestingEventService.record(VestingEventType.PAUSED, recipientAddress, null, null, now);

        log.info("Recipient paused: address={}, pausedAt={}", recipientAddress, now);
        return recipient;
    }

    /**
     * Resumes a paused recipient, shifting its cliff and end time by the paused duration.
     *
     * <p>After escrow termination the paused duration ends at {@code terminatedAt}: the
     * recipient is then valued at the termination instant, which with the shifted schedule
     * is exactly its value at the pause instant. The locked amount that seizure swept stays
     * unchanged and the vested balance becomes claimable.
     *
     * @param caller  Administrator address
     * @param address Recipient address
     * @return The resumed recipient
     */
    @Transactional(rollbackFor = Exception.class)
    public Recipient unpause(String caller, String address) throws VestingException {
        accessControlService.requireAdministrator(caller, "unpause recipient");
        String recipientAddress = Addresses.normalize(address, "Recipient");
        long now = vestingClock.now();
        Escrow escrow = escrowService.lockEscrow();

        Recipient recipient = vestingQueryService.requireRecipient(recipientAddress);
        statusStateMachine.validateTransition(recipientAddress, recipient.getStatus(), RecipientStatus.UNPAUSED);

        long resumedAt = escrow.isTerminated() ? Math.min(now, escrow.getTerminatedAt()) : now;
        long pausedFor = VestingScheduleCalculator.checkedSubtract(resumedAt, recipient.getLastPausedAt());
        recipient.setCliffDuration(Math.addExact(recipient.getCliffDuration(), pausedFor));
        recipient.setEndTime(Math.addExact(recipient.getEndTime(), pausedFor));
        recipient.setStatus(RecipientStatus.UNPAUSED);
        recipient.setUpdatedAt(LocalDateTime.now());
        recipientRepository.save(recipient);
        vestingEventService.record(VestingEventType.UNPAUSED, recipientAddress, null, null, now);

        log.info("Recipient unpaused: address={}, pausedFor={}, cliffDuration={}, endTime={}, escrowTerminated={}",
                recipientAddress, pausedFor, recipient.getCliffDuration(), recipient.getEndTime(), escrow.isTerminated());
        return recipient;
    }

    /**
     * Terminates a recipient.
     *
     * <p>The currently claimable amount is paid to the recipient (once the cliff has
     * passed), then the rest of the entitlement, {@code totalVestingAmount - totalClaimed},
     * is swept to the safe address. The recipient is immutable afterwards.
     *
     * @param caller  Administrator address
     * @param address Recipient address
     * @return How the remaining entitlement was split
     */
    @Transactional(rollbackFor = Exception.class)
    public RecipientTermination terminateRecipient(String caller, String address) throws VestingException {
        accessControlService.requireAdministrator(caller, "terminate recipient");
        String recipientAddress = Addresses.normalize(address, "Recipient");
        long now = vestingClock.now();
        Escrow escrow = escrowService.lockEscrow();
        escrow.requireActive("terminate recipient");

        Recipient recipient = vestingQueryService.requireRecipient(recipientAddress);
        statusStateMachine.validateTransition(recipientAddress, recipient.getStatus(), RecipientStatus.TERMINATED);

        long payout = now >= scheduleCalculator.claimStartTime(recipient)
                ? scheduleCalculator.claimableAmount(recipient, escrow, now)
                : 0L;

        log.info("Terminating recipient: address={}, status={}, payout={}, now={}",
                recipientAddress, recipient.getStatus(), payout, now);

        // Effects
        if (payout > 0) {
            escrow.recordClaim(recipient, payout);
        }
        long sweep = scheduleCalculator.remainingEntitlement(recipient);
        if (sweep > 0) {
            escrow.recordSeizure(sweep);
        }
        String safeAddress = escrow.getSafeAddress();

        recipient.setStatus(RecipientStatus.TERMINATED);
        recipient.setUpdatedAt(LocalDateTime.now());
        recipientRepository.save(recipient);
        escrowService.save(escrow);

        if (payout > 0) {
            vestingEventService.record(VestingEventType.CLAIMED, recipientAddress, recipientAddress, payout, now);
        }
        vestingEventService.record(VestingEventType.RECIPIENT_TERMINATED, recipientAddress, safeAddress, sweep, now);

        // Interactions
        if (payout > 0) {
            tokenLedger.push(recipientAddress, payout);
        }
        if (sweep > 0) {
            tokenLedger.push(safeAddress, sweep);
        }

        log.info("Recipient terminated: address={}, paidToRecipient={}, sweptToSafeAddress={}, safeAddress={}",
                recipientAddress, payout, sweep, safeAddress);

        return new RecipientTermination(recipientAddress, payout, sweep, safeAddress, now);
    }
}
