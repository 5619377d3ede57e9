package com.nosota.mvesting.service;

import com.nosota.mvesting.api.model.RecipientStatus;
import com.nosota.mvesting.error.StateConflictException;
import com.nosota.mvesting.model.Escrow;
import com.nosota.mvesting.model.Recipient;
import org.springframework.stereotype.Component;

/**
 * Valuation of a single vesting schedule.
 *
 * <p>Pure functions of the recipient fields, the escrow state and a clock reading.
 * Vesting runs linearly at {@code vestingPerSec} from the cliff to {@code endTime};
 * locked is what that rate still has to release:
 * <pre>
 *   PAUSED              vestingPerSec * (endTime - max(lastPausedAt, cliffStart))
 *   escrow TERMINATED   vestingPerSec * (endTime - max(terminatedAt, cliffStart))
 *   now >= endTime      0
 *   otherwise           vestingPerSec * (endTime - max(now, cliffStart))
 * </pre>
 * A pause freezes a recipient at its own pause instant even after the escrow is
 * terminated. Each freeze point at or past {@code endTime} yields 0.
 *
 * <p>{@code vestingPerSec} is truncated, so before the cliff locked is slightly below the
 * total and the difference becomes claimable once the cliff passes. At {@code endTime}
 * locked is 0 and the last claim empties the entitlement exactly.
 *
 * <p>All arithmetic is exact: overflow and any subtraction below zero throw
 * {@link ArithmeticException}.
 */
@Component
public class VestingScheduleCalculator {

    /**
     * Computes the fixed vesting rate of a new schedule.
     *
     * @return {@code totalVestingAmount / (endTime - startTime - cliffDuration)}, truncated
     * @throws ArithmeticException if the vesting window after the cliff is empty
     */
    public long vestingPerSec(long totalVestingAmount, long startTime, long endTime, long cliffDuration) {
        long window = checkedSubtract(checkedSubtract(endTime, startTime), cliffDuration);
        if (window == 0) {
            throw new ArithmeticException("Vesting window after the cliff is empty");
        }
        return totalVestingAmount / window;
    }

    /**
     * Amount not yet vested, capped at the recipient's remaining entitlement.
     *
     * @throws StateConflictException for terminated recipients, which have no locked amount
     */
    public long lockedAmount(Recipient recipient, Escrow escrow, long now) throws StateConflictException {
        requireNotTerminated(recipient);

        long endTime = recipient.getEndTime();
        long cliffStart = claimStartTime(recipient);
        long frozenAt;

        if (recipient.getStatus() == RecipientStatus.PAUSED) {
            frozenAt = recipient.getLastPausedAt();
        } else if (escrow.isTerminated()) {
            frozenAt = escrow.getTerminatedAt();
        } else {
            frozenAt = now;
        }

        if (frozenAt >= endTime) {
            return 0L;
        }

        long remainingSeconds = checkedSubtract(endTime, Math.max(frozenAt, cliffStart));
        long locked = Math.multiplyExact(recipient.getVestingPerSec(), remainingSeconds);
        return Math.min(locked, remainingEntitlement(recipient));
    }

    /**
     * Vested but not yet claimed: {@code totalVestingAmount - (totalClaimed + locked)}.
     *
     * @throws StateConflictException for terminated recipients
     */
    public long claimableAmount(Recipient recipient, Escrow escrow, long now) throws StateConflictException {
        long locked = lockedAmount(recipient, escrow, now);
        return checkedSubtract(recipient.getTotalVestingAmount(), Math.addExact(recipient.getTotalClaimed(), locked));
    }

    /**
     * A recipient can claim when unpaused and past the cliff.
     */
    public boolean canClaim(Recipient recipient, long now) {
        return recipient.getStatus() == RecipientStatus.UNPAUSED && now >= claimStartTime(recipient);
    }

    public long claimStartTime(Recipient recipient) {
        return Math.addExact(recipient.getStartTime(), recipient.getCliffDuration());
    }

    /**
     * {@code totalVestingAmount - totalClaimed}.
     */
    public long remainingEntitlement(Recipient recipient) {
        return checkedSubtract(recipient.getTotalVestingAmount(), recipient.getTotalClaimed());
    }

    private void requireNotTerminated(Recipient recipient) throws StateConflictException {
        if (recipient.getStatus() == RecipientStatus.TERMINATED) {
            throw new StateConflictException(
                    "Recipient " + recipient.getAddress() + " is terminated and has no locked or claimable amount");
        }
    }

    static long checkedSubtract(long minuend, long subtrahend) {
        if (subtrahend > minuend) {
            throw new ArithmeticException(String.format("Unsigned underflow: %d - %d", minuend, subtrahend));
        }
        return minuend - subtrahend;
    }
}
