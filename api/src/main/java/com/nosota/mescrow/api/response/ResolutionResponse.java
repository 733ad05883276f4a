package com.nosota.mescrow.api.response;

import java.util.UUID;

/**
 * Outcome of a dispute resolution.
 *
 * <p>{@code buyerAmount + sellerAmount + destroyedAmount} always equals the escrow amount.
 */
public record ResolutionResponse(
        UUID disputeId,
        UUID escrowId,
        String resolution,
        Long buyerAmount,
        Long sellerAmount,
        Long destroyedAmount
) {}
