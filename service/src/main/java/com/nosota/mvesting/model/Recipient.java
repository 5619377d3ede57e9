package com.nosota.mvesting.model;

import com.nosota.mvesting.api.model.RecipientStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Vesting schedule of a single beneficiary.
 *
 * <p>The address is the identity: there is at most one recipient per address.
 * All time fields are epoch seconds of the vesting clock, all amounts are token units.
 *
 * <p><b>Lifecycle:</b>
 * <pre>
 * 1. UNPAUSED: created by an allocation batch, vests at vestingPerSec after the cliff
 * 2. PAUSED: progress frozen at lastPausedAt; unpause shifts cliffDuration and endTime
 * 3. TERMINATED: paid out and swept, immutable
 * </pre>
 */
@Entity
@Table(name = "recipient")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Recipient {

    /**
     * Lower-case 0x-prefixed address.
     */
    @Id
    @Column(name = "address", length = 42, updatable = false, nullable = false)
    private String address;

    @Column(name = "start_time", nullable = false)
    private Long startTime;

    /**
     * End of vesting. Moves forward by the paused duration on every unpause.
     */
    @Column(name = "end_time", nullable = false)
    private Long endTime;

    /**
     * Seconds after startTime before anything can be claimed.
     * Moves forward by the paused duration on every unpause.
     * Always strictly less than {@code endTime - startTime}.
     */
    @Column(name = "cliff_duration", nullable = false)
    private Long cliffDuration;

    /**
     * Instant of the most recent pause, 0 if never paused.
     */
    @Column(name = "last_paused_at", nullable = false)
    private Long lastPausedAt = 0L;

    /**
     * {@code totalVestingAmount / (endTime - startTime - cliffDuration)}, truncated.
     * Computed once at creation, never recomputed.
     */
    @Column(name = "vesting_per_sec", nullable = false, updatable = false)
    private Long vestingPerSec;

    @Column(name = "total_vesting_amount", nullable = false, updatable = false)
    private Long totalVestingAmount;

    /**
     * Monotonically increasing, never above totalVestingAmount.
     */
    @Column(name = "total_claimed", nullable = false)
    private Long totalClaimed = 0L;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private RecipientStatus status = RecipientStatus.UNPAUSED;

    /**
     * Set once the locked balance was swept after escrow termination.
     */
    @Column(name = "seized", nullable = false)
    private boolean seized;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isTerminated() {
        return status == RecipientStatus.TERMINATED;
    }
}
