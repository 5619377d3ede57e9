package com.nosota.mvesting.service;

import com.nosota.mvesting.api.model.RecipientStatus;
import com.nosota.mvesting.api.model.VestingEventType;
import com.nosota.mvesting.dto.AllocationResult;
import com.nosota.mvesting.dto.ClaimResult;
import com.nosota.mvesting.error.*;
import com.nosota.mvesting.model.Escrow;
import com.nosota.mvesting.model.Recipient;
import com.nosota.mvesting.repository.RecipientRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Allocation ledger: funds the escrow, creates vesting schedules and pays out claims.
 *
 * <p>Both operations are all or nothing. They lock the escrow row first, validate every
 * precondition, update the accounting, and only then move tokens.
 *
 * <p>Configuration:
 * <pre>
 * vesting:
 *   allow-past-start-time: false   # accept schedules that already started
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AllocationService {

    private final RecipientRepository recipientRepository;
    private final EscrowService escrowService;
    private final VestingQueryService vestingQueryService;
    private final VestingScheduleCalculator scheduleCalculator;
    private final AccessControlService accessControlService;
    private final VestingEventService vestingEventService;
    private final TokenLedger tokenLedger;
    private final VestingClock vestingClock;

    @Value("${vesting.allow-past-start-time:false}")
    private boolean allowPastStartTime;

    /**
     * Pulls {@code totalFunding} from the administrator and creates one UNPAUSED recipient
     * per entry of the parallel lists.
     *
     * <p>The whole batch is rejected if any entry is invalid, if an address is listed twice
     * or is already a recipient, or if the amounts exceed the funding. Funding not assigned
     * to a recipient is added to the escrow dust.
     *
     * @param caller         Administrator address
     * @param addresses      Recipient addresses
     * @param amounts        Total vesting amount per recipient
     * @param startTimes     Vesting start per recipient
     * @param endTimes       Vesting end per recipient
     * @param cliffDurations Cliff length per recipient
     * @param totalFunding   Amount to pull from the administrator
     * @return Batch summary
     */
    @Transactional(rollbackFor = Exception.class)
    public AllocationResult addRecipients(String caller,
                                          List<String> addresses,
                                          List<Long> amounts,
                                          List<Long> startTimes,
                                          List<Long> endTimes,
                                          List<Long> cliffDurations,
                                          Long totalFunding) throws VestingException {
        String administrator = accessControlService.requireAdministrator(caller, "add recipients");
        long now = vestingClock.now();
        Escrow escrow = escrowService.lockEscrow();
        escrow.requireActive("add recipients");

        validateBatchShape(addresses, amounts, startTimes, endTimes, cliffDurations, totalFunding);

        log.info("Processing allocation batch: administrator={}, count={}, totalFunding={}",
                administrator, addresses.size(), totalFunding);

        // 1. Build and validate every schedule before touching any state
        Set<String> batchAddresses = new LinkedHashSet<>();
        List<Recipient> recipients = new ArrayList<>(addresses.size());
        long totalAllocated = 0L;
        LocalDateTime createdAt = LocalDateTime.now();

        for (int i = 0; i < addresses.size(); i++) {
            String address = normalizeEntryAddress(addresses.get(i), i);
            if (!batchAddresses.add(address)) {
                throw new InvalidScheduleException("Entry " + i + ": address " + address + " is listed twice in the batch");
            }

            Recipient recipient = buildRecipient(i, address, amounts.get(i), startTimes.get(i),
                    endTimes.get(i), cliffDurations.get(i), now, createdAt);
            recipients.add(recipient);
            totalAllocated = Math.addExact(totalAllocated, recipient.getTotalVestingAmount());
        }

        List<Recipient> existing = recipientRepository.findByAddressIn(batchAddresses);
        if (!existing.isEmpty()) {
            throw new StateConflictException("Addresses already registered as recipients: " +
                    existing.stream().map(Recipient::getAddress).collect(Collectors.joining(", ")));
        }

        // 2. Funds arrive before anything is allocated
        tokenLedger.pull(administrator, totalFunding);
        vestingEventService.record(VestingEventType.FUNDS_RECEIVED, null, administrator, totalFunding, now);

        // 3. Book the batch on the escrow and store the schedules
        long dustAdded = escrow.recordAllocation(totalAllocated, totalFunding);
        escrowService.save(escrow);
        recipientRepository.saveAll(recipients);

        for (Recipient recipient : recipients) {
            vestingEventService.record(VestingEventType.RECIPIENT_ADDED, recipient.getAddress(), null,
                    recipient.getTotalVestingAmount(), now);
            log.debug("Recipient added: address={}, amount={}, start={}, end={}, cliff={}, vestingPerSec={}",
                    recipient.getAddress(), recipient.getTotalVestingAmount(), recipient.getStartTime(),
                    recipient.getEndTime(), recipient.getCliffDuration(), recipient.getVestingPerSec());
        }

        log.info("Allocation batch completed: count={}, totalFunding={}, totalAllocated={}, dustAdded={}, totalAllocatedSupply={}",
                recipients.size(), totalFunding, totalAllocated, dustAdded, escrow.getTotalAllocatedSupply());

        return new AllocationResult(recipients.size(), totalFunding, totalAllocated, dustAdded);
    }

    /**
     * Transfers {@code amount} of vested tokens to the calling recipient.
     *
     * <p>Allowed after escrow termination: the recipient keeps what had vested before it.
     *
     * @param caller Recipient address
     * @param amount Amount to claim
     * @return Claim summary
     * @throws StateConflictException           if the recipient is paused or terminated
     * @throws ClaimExceedsEntitlementException if the cliff has not passed or the amount exceeds the claimable amount
     */
    @Transactional(rollbackFor = Exception.class)
    public ClaimResult claim(String caller, Long amount) throws VestingException {
        if (amount == null || amount <= 0) {
            throw new IllegalArgumentException("Claim amount must be positive: " + amount);
        }
        String address = Addresses.normalize(caller, "Caller");
        long now = vestingClock.now();
        Escrow escrow = escrowService.lockEscrow();
        Recipient recipient = vestingQueryService.requireRecipient(address);

        if (recipient.getStatus() != RecipientStatus.UNPAUSED) {
            throw new StateConflictException(
                    "Recipient " + address + " is " + recipient.getStatus() + ": claims require UNPAUSED");
        }
        if (!scheduleCalculator.canClaim(recipient, now)) {
            throw new ClaimExceedsEntitlementException(String.format(
                    "Cliff not reached for %s: claims open at %d, now=%d",
                    address, scheduleCalculator.claimStartTime(recipient), now));
        }

        long claimable = scheduleCalculator.claimableAmount(recipient, escrow, now);
        if (amount > claimable) {
            throw new ClaimExceedsEntitlementException(String.format(
                    "Claim exceeds claimable amount for %s: requested=%d, claimable=%d", address, amount, claimable));
        }

        log.info("Processing claim: recipient={}, amount={}, claimable={}, now={}", address, amount, claimable, now);

        // Effects
        escrow.recordClaim(recipient, amount);
        recipient.setUpdatedAt(LocalDateTime.now());
        recipientRepository.save(recipient);
        escrowService.save(escrow);
        vestingEventService.record(VestingEventType.CLAIMED, address, address, amount, now);

        // Interaction
        tokenLedger.push(address, amount);

        log.info("Claim completed: recipient={}, amount={}, totalClaimed={}, escrowTotalClaimed={}",
                address, amount, recipient.getTotalClaimed(), escrow.getTotalClaimed());

        return new ClaimResult(address, amount, recipient.getTotalClaimed(), claimable - amount, now);
    }

    // ==================== Private Helper Methods ====================

    private void validateBatchShape(List<String> addresses, List<Long> amounts, List<Long> startTimes,
                                    List<Long> endTimes, List<Long> cliffDurations, Long totalFunding)
            throws InvalidScheduleException {
        if (addresses == null || addresses.isEmpty()) {
            throw new InvalidScheduleException("Allocation batch must contain at least one recipient");
        }
        int size = addresses.size();
        if (amounts == null || startTimes == null || endTimes == null || cliffDurations == null
                || amounts.size() != size || startTimes.size() != size
                || endTimes.size() != size || cliffDurations.size() != size) {
            throw new InvalidScheduleException(String.format(
                    "Allocation lists must have equal lengths: addresses=%d, amounts=%s, startTimes=%s, endTimes=%s, cliffDurations=%s",
                    size, sizeOf(amounts), sizeOf(startTimes), sizeOf(endTimes), sizeOf(cliffDurations)));
        }
        if (totalFunding == null || totalFunding <= 0) {
            throw new InvalidScheduleException("Total funding must be positive: " + totalFunding);
        }
    }

    private String normalizeEntryAddress(String address, int index) throws InvalidAddressException {
        return Addresses.normalize(address, "Entry " + index + " recipient");
    }

    private Recipient buildRecipient(int index, String address, Long amount, Long startTime, Long endTime,
                                     Long cliffDuration, long now, LocalDateTime createdAt)
            throws InvalidScheduleException {
        String entry = "Entry " + index + " (" + address + "): ";
        if (amount == null || startTime == null || endTime == null || cliffDuration == null) {
            throw new InvalidScheduleException(entry + "amount, start, end and cliff are all required");
        }
        if (amount <= 0) {
            throw new InvalidScheduleException(entry + "amount must be positive, got " + amount);
        }
        if (startTime < 0 || cliffDuration < 0) {
            throw new InvalidScheduleException(entry + "start time and cliff duration must not be negative");
        }
        if (!allowPastStartTime && startTime <= now) {
            throw new InvalidScheduleException(entry + "start time " + startTime + " is not in the future (now=" + now + ")");
        }
        if (endTime <= startTime) {
            throw new InvalidScheduleException(entry + "end time " + endTime + " must be after start time " + startTime);
        }
        if (cliffDuration >= endTime - startTime) {
            throw new InvalidScheduleException(entry + "cliff duration " + cliffDuration +
                    " must be shorter than the vesting duration " + (endTime - startTime));
        }

        Recipient recipient = new Recipient();
        recipient.setAddress(address);
        recipient.setStartTime(startTime);
        recipient.setEndTime(endTime);
        recipient.setCliffDuration(cliffDuration);
        recipient.setLastPausedAt(0L);
        recipient.setVestingPerSec(scheduleCalculator.vestingPerSec(amount, startTime, endTime, cliffDuration));
        recipient.setTotalVestingAmount(amount);
        recipient.setTotalClaimed(0L);
        recipient.setStatus(RecipientStatus.UNPAUSED);
        recipient.setSeized(false);
        recipient.setCreatedAt(createdAt);
        recipient.setUpdatedAt(createdAt);
        return recipient;
    }

    private static String sizeOf(List<?> list) {
        return list == null ? "null" : String.valueOf(list.size());
    }
}
