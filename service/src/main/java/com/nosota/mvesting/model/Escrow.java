package com.nosota.mvesting.model;

import com.nosota.mvesting.api.model.EscrowStatus;
import com.nosota.mvesting.error.ClaimExceedsEntitlementException;
import com.nosota.mvesting.error.EscrowNotTerminatedException;
import com.nosota.mvesting.error.EscrowTerminatedException;
import com.nosota.mvesting.error.InsufficientFundsException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Escrow aggregate: the single row holding the global vesting ledger.
 *
 * <p>Every operation that changes global totals goes through the methods of this class,
 * which own the conservation checks:
 * <ul>
 *   <li>{@code totalClaimed <= totalAllocatedSupply}</li>
 *   <li>{@code totalClaimed + totalSeized <= totalAllocatedSupply}</li>
 *   <li>{@code recipient.totalClaimed <= recipient.totalVestingAmount}</li>
 * </ul>
 *
 * <p>The row is read with a pessimistic write lock by every mutating service call, which
 * serializes all operations on the escrow.
 */
@Entity
@Table(name = "escrow")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Escrow {

    public static final Integer SINGLETON_ID = 1;

    @Id
    private Integer id;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private EscrowStatus status = EscrowStatus.ACTIVE;

    /**
     * Set exactly once, when status becomes TERMINATED.
     */
    @Column(name = "terminated_at")
    private Long terminatedAt;

    /**
     * Destination for swept balances and dust. Never the zero address.
     */
    @Column(name = "safe_address", nullable = false, length = 42)
    private String safeAddress;

    /**
     * Account of the escrow itself in the token ledger.
     */
    @Column(name = "escrow_address", nullable = false, length = 42, updatable = false)
    private String escrowAddress;

    @Column(name = "total_allocated_supply", nullable = false)
    private Long totalAllocatedSupply = 0L;

    @Column(name = "total_claimed", nullable = false)
    private Long totalClaimed = 0L;

    /**
     * Balances swept to the safe address by recipient termination and seizure.
     */
    @Column(name = "total_seized", nullable = false)
    private Long totalSeized = 0L;

    @Column(name = "dust", nullable = false)
    private Long dust = 0L;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isTerminated() {
        return status == EscrowStatus.TERMINATED;
    }

    public void requireActive(String operation) throws EscrowTerminatedException {
        if (isTerminated()) {
            throw new EscrowTerminatedException(
                    "Cannot " + operation + ": escrow was terminated at " + terminatedAt);
        }
    }

    public void requireTerminated(String operation) throws EscrowNotTerminatedException {
        if (!isTerminated()) {
            throw new EscrowNotTerminatedException("Cannot " + operation + ": escrow is not terminated");
        }
    }

    /**
     * Freezes the escrow at {@code now}. One-way.
     */
    public void terminate(long now) throws EscrowTerminatedException {
        requireActive("terminate escrow");
        status = EscrowStatus.TERMINATED;
        terminatedAt = now;
    }

    /**
     * Books a funded allocation batch. Whatever the allocations leave of the funding becomes dust.
     *
     * @return dust added by this batch
     */
    public long recordAllocation(long allocated, long funding) throws InsufficientFundsException {
        if (allocated > funding) {
            throw new InsufficientFundsException(String.format(
                    "Funding does not cover allocations: funding=%d, allocated=%d", funding, allocated));
        }
        long batchDust = funding - allocated;
        totalAllocatedSupply = Math.addExact(totalAllocatedSupply, allocated);
        dust = Math.addExact(dust, batchDust);
        return batchDust;
    }

    /**
     * Books a payout to a recipient against both the recipient's and the global caps.
     * Nothing is changed if either cap would be exceeded.
     */
    public void recordClaim(Recipient recipient, long amount) throws ClaimExceedsEntitlementException {
        long recipientClaimed = Math.addExact(recipient.getTotalClaimed(), amount);
        if (recipientClaimed > recipient.getTotalVestingAmount()) {
            throw new ClaimExceedsEntitlementException(String.format(
                    "Recipient %s would exceed its entitlement: claimed=%d, amount=%d, total=%d",
                    recipient.getAddress(), recipient.getTotalClaimed(), amount, recipient.getTotalVestingAmount()));
        }
        long globalClaimed = Math.addExact(totalClaimed, amount);
        if (globalClaimed > totalAllocatedSupply || Math.addExact(globalClaimed, totalSeized) > totalAllocatedSupply) {
            throw new ClaimExceedsEntitlementException(String.format(
                    "Escrow would exceed its allocated supply: claimed=%d, seized=%d, amount=%d, allocated=%d",
                    totalClaimed, totalSeized, amount, totalAllocatedSupply));
        }
        recipient.setTotalClaimed(recipientClaimed);
        totalClaimed = globalClaimed;
    }

    /**
     * Books a sweep of locked balances to the safe address.
     */
    public void recordSeizure(long amount) throws ClaimExceedsEntitlementException {
        long seized = Math.addExact(totalSeized, amount);
        if (Math.addExact(totalClaimed, seized) > totalAllocatedSupply) {
            throw new ClaimExceedsEntitlementException(String.format(
                    "Seizure would exceed the allocated supply: claimed=%d, seized=%d, amount=%d, allocated=%d",
                    totalClaimed, totalSeized, amount, totalAllocatedSupply));
        }
        totalSeized = seized;
    }

    /**
     * Resets dust to zero and returns the previous value.
     */
    public long takeDust() {
        long taken = dust;
        dust = 0L;
        return taken;
    }
}
