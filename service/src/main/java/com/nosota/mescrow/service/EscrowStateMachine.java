package com.nosota.mescrow.service;

import com.nosota.mescrow.api.model.EscrowStatus;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating EscrowStatus transitions.
 *
 * <p>State diagram:
 * <pre>
 *               HELD
 *                |
 *     +----------+----------+
 *     |          |          |
 *  RELEASED   REFUNDED   DISPUTED
 *                           |
 *                     +-----+-----+
 *                     |           |
 *                  RELEASED   REFUNDED
 * </pre>
 *
 * <p>RELEASED and REFUNDED are final.
 */
@Component
public class EscrowStateMachine {

    private static final Map<EscrowStatus, Set<EscrowStatus>> ALLOWED_TRANSITIONS = Map.of(
            EscrowStatus.HELD, EnumSet.of(
                    EscrowStatus.RELEASED,
                    EscrowStatus.REFUNDED,
                    EscrowStatus.DISPUTED
            ),
            EscrowStatus.DISPUTED, EnumSet.of(
                    EscrowStatus.RELEASED,
                    EscrowStatus.REFUNDED
            )
    );

    /**
     * Checks whether {@code fromStatus → toStatus} is a legal transition. Staying in place is not.
     */
    public boolean isTransitionAllowed(EscrowStatus fromStatus, EscrowStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        Set<EscrowStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Validates a transition, throwing if it is not allowed.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public void validateTransition(EscrowStatus fromStatus, EscrowStatus toStatus) {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new IllegalStateException(
                    String.format("Invalid escrow status transition: %s → %s. Allowed transitions from %s: %s",
                            fromStatus, toStatus, fromStatus,
                            ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of()))
            );
        }
    }

    public boolean isFinalState(EscrowStatus status) {
        return status == EscrowStatus.RELEASED || status == EscrowStatus.REFUNDED;
    }
}
