package com.nosota.mescrow.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request DTO for creating an escrow directly (outside of checkout).
 *
 * @param buyerId  Buyer whose wallet is debited
 * @param sellerId Seller who receives the funds on release
 * @param amount   Amount in sats (must be positive)
 * @param holdDays Days until auto-release; null uses the configured default
 */
public record CreateEscrowRequest(
        @NotBlank(message = "Buyer ID is required")
        String buyerId,

        @NotBlank(message = "Seller ID is required")
        String sellerId,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount,

        @PositiveOrZero(message = "Hold days must not be negative")
        Integer holdDays
) {
}
