package com.nosota.mescrow.api.response;

import com.nosota.mescrow.api.model.DisputeStatus;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Response DTO for disputes.
 *
 * @param id              Dispute UUID
 * @param orderId         Disputed order
 * @param escrowId        Escrow bound to the order
 * @param initiatedBy     User who opened the dispute
 * @param reason          Reason given by the initiator
 * @param status          OPEN or RESOLVED
 * @param resolution      Resolution string (null while OPEN)
 * @param resolutionNotes Adjudicator notes
 * @param resolvedBy      Adjudicator who resolved the dispute
 * @param warningSentAt   When the auto-resolve warning was delivered
 * @param autoResolveAt   Auto-resolve deadline fixed at open time
 * @param createdAt       Open timestamp
 * @param resolvedAt      Resolution timestamp
 */
public record DisputeResponse(
        UUID id,
        UUID orderId,
        UUID escrowId,
        String initiatedBy,
        String reason,
        DisputeStatus status,
        String resolution,
        String resolutionNotes,
        String resolvedBy,
        LocalDateTime warningSentAt,
        LocalDateTime autoResolveAt,
        LocalDateTime createdAt,
        LocalDateTime resolvedAt
) {}
