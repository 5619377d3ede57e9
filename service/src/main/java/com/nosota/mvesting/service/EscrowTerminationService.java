package com.nosota.mvesting.service;

import com.nosota.mvesting.api.model.VestingEventType;
import com.nosota.mvesting.dto.SeizureResult;
import com.nosota.mvesting.error.InvalidAddressException;
import com.nosota.mvesting.error.VestingException;
import com.nosota.mvesting.model.Escrow;
import com.nosota.mvesting.model.Recipient;
import com.nosota.mvesting.repository.RecipientRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Escrow-wide administrative operations: termination, seizure of locked balances,
 * dust sweep and the safe address.
 *
 * <p>Termination only changes how locked amounts are valued (frozen at
 * {@code terminatedAt}); it moves no funds. The locked balances are moved later by
 * {@link #seizeLockedTokens}, at most once per recipient.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowTerminationService {

    private final RecipientRepository recipientRepository;
    private final EscrowService escrowService;
    private final VestingQueryService vestingQueryService;
    private final VestingScheduleCalculator scheduleCalculator;
    private final AccessControlService accessControlService;
    private final VestingEventService vestingEventService;
    private final TokenLedger tokenLedger;
    private final VestingClock vestingClock;

    /**
     * Terminates the escrow at the current instant. One-way.
     */
    @Transactional(rollbackFor = Exception.class)
    public Escrow terminateEscrow(String caller) throws VestingException {
        accessControlService.requireAdministrator(caller, "terminate escrow");
        long now = vestingClock.now();
        Escrow escrow = escrowService.lockEscrow();

        escrow.terminate(now);
        escrowService.save(escrow);
        vestingEventService.record(VestingEventType.ESCROW_TERMINATED, null, null, null, now);

        log.info("Escrow terminated: terminatedAt={}, totalAllocatedSupply={}, totalClaimed={}",
                now, escrow.getTotalAllocatedSupply(), escrow.getTotalClaimed());
        return escrow;
    }

    /**
     * Sweeps the frozen locked balances of the given recipients to the safe address in a
     * single transfer.
     *
     * <p>Recipients that were terminated individually or were already seized contribute
     * nothing and are skipped; calling this twice with the same addresses seizes once.
     *
     * @param caller    Administrator address
     * @param addresses Recipient addresses
     * @return What was seized and what was skipped
     */
    @Transactional(rollbackFor = Exception.class)
    public SeizureResult seizeLockedTokens(String caller, List<String> addresses) throws VestingException {
        accessControlService.requireAdministrator(caller, "seize locked tokens");
        long now = vestingClock.now();
        Escrow escrow = escrowService.lockEscrow();
        escrow.requireTerminated("seize locked tokens");

        Set<String> targets = new LinkedHashSet<>();
        for (String address : addresses == null ? List.<String>of() : addresses) {
            targets.add(Addresses.normalize(address, "Recipient"));
        }

        List<String> seizedAddresses = new ArrayList<>();
        List<String> skippedAddresses = new ArrayList<>();
        List<Recipient> seizedRecipients = new ArrayList<>();
        List<Long> seizedAmounts = new ArrayList<>();
        long totalSeized = 0L;

        for (String address : targets) {
            Recipient recipient = vestingQueryService.requireRecipient(address);
            if (recipient.isTerminated() || recipient.isSeized()) {
                log.debug("Skipping seizure: address={}, status={}, seized={}",
                        address, recipient.getStatus(), recipient.isSeized());
                skippedAddresses.add(address);
                continue;
            }

            long locked = scheduleCalculator.lockedAmount(recipient, escrow, now);
            recipient.setSeized(true);
            recipient.setUpdatedAt(LocalDateTime.now());
            totalSeized = Math.addExact(totalSeized, locked);

            seizedRecipients.add(recipient);
            seizedAddresses.add(address);
            seizedAmounts.add(locked);
        }

        String safeAddress = escrow.getSafeAddress();

        // Effects
        escrow.recordSeizure(totalSeized);
        escrowService.save(escrow);
        recipientRepository.saveAll(seizedRecipients);
        for (int i = 0; i < seizedAddresses.size(); i++) {
            vestingEventService.record(VestingEventType.LOCKED_TOKENS_SEIZED, seizedAddresses.get(i),
                    safeAddress, seizedAmounts.get(i), now);
        }

        // Interaction
        if (totalSeized > 0) {
            tokenLedger.push(safeAddress, totalSeized);
        }

        log.info("Locked tokens seized: amount={}, seized={}, skipped={}, safeAddress={}",
                totalSeized, seizedAddresses.size(), skippedAddresses.size(), safeAddress);

        return new SeizureResult(totalSeized, seizedAddresses, skippedAddresses, safeAddress);
    }

    /**
     * Sweeps the accumulated dust to the safe address. Dust is reset before the transfer.
     *
     * @return Amount swept, 0 if there was no dust
     */
    @Transactional(rollbackFor = Exception.class)
    public long transferDust(String caller) throws VestingException {
        accessControlService.requireAdministrator(caller, "transfer dust");
        long now = vestingClock.now();
        Escrow escrow = escrowService.lockEscrow();

        long dust = escrow.takeDust();
        if (dust == 0) {
            log.info("No dust to transfer");
            return 0L;
        }
        String safeAddress = escrow.getSafeAddress();

        // Effects
        escrowService.save(escrow);
        vestingEventService.record(VestingEventType.DUST_TRANSFERRED, null, safeAddress, dust, now);

        // Interaction
        tokenLedger.push(safeAddress, dust);

        log.info("Dust transferred: amount={}, safeAddress={}", dust, safeAddress);
        return dust;
    }

    /**
     * Replaces the destination of sweeps and dust.
     *
     * @throws InvalidAddressException if the address is malformed or zero
     */
    @Transactional(rollbackFor = Exception.class)
    public Escrow updateSafeAddress(String caller, String safeAddress) throws VestingException {
        accessControlService.requireAdministrator(caller, "update safe address");
        long now = vestingClock.now();
        Escrow escrow = escrowService.lockEscrow();
        escrow.requireActive("update safe address");

        String normalized = Addresses.normalize(safeAddress, "Safe");
        String previous = escrow.getSafeAddress();
        escrow.setSafeAddress(normalized);
        escrowService.save(escrow);
        vestingEventService.record(VestingEventType.SAFE_ADDRESS_UPDATED, null, normalized, null, now);

        log.info("Safe address updated: previous={}, current={}", previous, normalized);
        return escrow;
    }
}
