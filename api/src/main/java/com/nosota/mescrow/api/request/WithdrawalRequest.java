package com.nosota.mescrow.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request DTO for withdrawing funds to an external invoice.
 *
 * @param invoice Payable invoice reference
 * @param amount  Amount in sats (must be positive)
 */
public record WithdrawalRequest(
        @NotBlank(message = "Invoice is required")
        String invoice,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount
) {
}
