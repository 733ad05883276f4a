package com.nosota.mescrow.api.response;

import com.nosota.mescrow.api.model.EscrowStatus;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Response DTO for escrow operations.
 *
 * @param id            Escrow UUID
 * @param buyerId       Buyer whose funds are held
 * @param sellerId      Seller receiving funds on release
 * @param amount        Held amount in sats
 * @param status        Current status
 * @param autoReleaseAt Deadline after which a HELD escrow is released automatically
 * @param createdAt     Creation timestamp
 * @param resolvedAt    Timestamp of the final transition (null while HELD or DISPUTED)
 */
public record EscrowResponse(
        UUID id,
        String buyerId,
        String sellerId,
        Long amount,
        EscrowStatus status,
        LocalDateTime autoReleaseAt,
        LocalDateTime createdAt,
        LocalDateTime resolvedAt
) {}
