package com.nosota.mvesting.service;

import com.nosota.mvesting.api.model.EscrowStatus;
import com.nosota.mvesting.error.InvalidAddressException;
import com.nosota.mvesting.model.Escrow;
import com.nosota.mvesting.repository.EscrowRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Access to the escrow aggregate.
 *
 * <p>The escrow row is created lazily by the first mutating operation, with the escrow
 * and safe addresses from configuration:
 * <pre>
 * vesting:
 *   escrow-address: 0x...        # escrow account in the token ledger
 *   initial-safe-address: 0x...  # first destination for sweeps
 * </pre>
 */
@Service
@Slf4j
public class EscrowService {

    private final EscrowRepository escrowRepository;
    private final String escrowAddress;
    private final String initialSafeAddress;

    public EscrowService(EscrowRepository escrowRepository,
                         @Value("${vesting.escrow-address}") String escrowAddress,
                         @Value("${vesting.initial-safe-address}") String initialSafeAddress)
            throws InvalidAddressException {
        this.escrowRepository = escrowRepository;
        this.escrowAddress = Addresses.normalize(escrowAddress, "Escrow");
        this.initialSafeAddress = Addresses.normalize(initialSafeAddress, "Safe");
    }

    /**
     * Loads the escrow with a pessimistic write lock, creating it on first use.
     * Must be the first repository access of every mutating operation.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Escrow lockEscrow() {
        Optional<Escrow> existing = escrowRepository.findByIdForUpdate(Escrow.SINGLETON_ID);
        if (existing.isPresent()) {
            return existing.get();
        }

        if (escrowRepository.insertIfAbsent(Escrow.SINGLETON_ID, escrowAddress, initialSafeAddress) > 0) {
            log.info("Creating escrow: escrowAddress={}, safeAddress={}", escrowAddress, initialSafeAddress);
        }
        return escrowRepository.findByIdForUpdate(Escrow.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Escrow row missing after insert"));
    }

    /**
     * Returns the escrow for reading; before the first operation this is the unsaved initial state.
     */
    @Transactional(readOnly = true)
    public Escrow getEscrow() {
        return escrowRepository.findById(Escrow.SINGLETON_ID)
                .orElseGet(this::newEscrow);
    }

    public Escrow save(Escrow escrow) {
        escrow.setUpdatedAt(LocalDateTime.now());
        return escrowRepository.save(escrow);
    }

    public String getEscrowAddress() {
        return escrowAddress;
    }

    private Escrow newEscrow() {
        Escrow escrow = new Escrow();
        escrow.setId(Escrow.SINGLETON_ID);
        escrow.setStatus(EscrowStatus.ACTIVE);
        escrow.setEscrowAddress(escrowAddress);
        escrow.setSafeAddress(initialSafeAddress);
        escrow.setTotalAllocatedSupply(0L);
        escrow.setTotalClaimed(0L);
        escrow.setTotalSeized(0L);
        escrow.setDust(0L);
        escrow.setUpdatedAt(LocalDateTime.now());
        return escrow;
    }
}
