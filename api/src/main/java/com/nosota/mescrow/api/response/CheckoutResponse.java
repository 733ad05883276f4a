package com.nosota.mescrow.api.response;

import com.nosota.mescrow.api.model.CheckoutStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for checkout sessions.
 *
 * @param id          Session UUID
 * @param userId      Buyer
 * @param status      PENDING, PAID or EXPIRED
 * @param totalAmount Sum of locked prices (sats)
 * @param feeAmount   Marketplace fee (sats)
 * @param createdAt   Creation timestamp
 * @param expiresAt   End of the price lock
 * @param paidAt      Payment timestamp
 * @param items       Price-locked items
 */
public record CheckoutResponse(
        UUID id,
        String userId,
        CheckoutStatus status,
        Long totalAmount,
        Long feeAmount,
        LocalDateTime createdAt,
        LocalDateTime expiresAt,
        LocalDateTime paidAt,
        List<CheckoutItemResponse> items
) {}
