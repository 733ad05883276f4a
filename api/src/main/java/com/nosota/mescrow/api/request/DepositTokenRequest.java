package com.nosota.mescrow.api.request;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for depositing an external payment token into a wallet.
 *
 * @param token Opaque payment token, redeemed by the payment processor
 */
public record DepositTokenRequest(
        @NotBlank(message = "Token is required")
        String token
) {
}
