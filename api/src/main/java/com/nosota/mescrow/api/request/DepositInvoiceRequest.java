package com.nosota.mescrow.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request DTO for creating a deposit invoice.
 *
 * @param amount Amount in sats (must be positive)
 */
public record DepositInvoiceRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount
) {
}
