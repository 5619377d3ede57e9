package com.nosota.mvesting.service;

import com.nosota.mvesting.api.model.RecipientStatus;
import com.nosota.mvesting.error.StateConflictException;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating RecipientStatus transitions.
 *
 * <p>State diagram:
 * <pre>
 *   UNPAUSED ──pause──▶ PAUSED
 *      ▲                  │
 *      └─────unpause──────┘
 *      │                  │
 *   terminate          terminate
 *      ▼                  ▼
 *         TERMINATED
 * </pre>
 *
 * <p>Unlike transaction statuses, a transition to the same status is a conflict here:
 * pausing a paused recipient would overwrite {@code lastPausedAt} and lose paused time.
 */
@Component
public class RecipientStatusStateMachine {

    private static final Map<RecipientStatus, Set<RecipientStatus>> ALLOWED_TRANSITIONS = Map.of(
            RecipientStatus.UNPAUSED, EnumSet.of(RecipientStatus.PAUSED, RecipientStatus.TERMINATED),
            RecipientStatus.PAUSED, EnumSet.of(RecipientStatus.UNPAUSED, RecipientStatus.TERMINATED)
            // TERMINATED is final
    );

    public boolean isTransitionAllowed(RecipientStatus fromStatus, RecipientStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        Set<RecipientStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Validates a transition, throwing if it is not allowed.
     *
     * @param address    Recipient address, for the error message
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @throws StateConflictException if the transition is not allowed
     */
    public void validateTransition(String address, RecipientStatus fromStatus, RecipientStatus toStatus)
            throws StateConflictException {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new StateConflictException(String.format(
                    "Invalid recipient status transition for %s: %s → %s. Allowed transitions from %s: %s",
                    address, fromStatus, toStatus, fromStatus,
                    ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of())));
        }
    }

    public boolean isFinalState(RecipientStatus status) {
        return status == RecipientStatus.TERMINATED;
    }
}
