package com.nosota.mescrow.api.request;

import com.nosota.mescrow.api.model.PaymentMethod;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for paying a checkout session.
 *
 * @param method Payment method (WALLET or TOKEN)
 * @param token  Payment token, required for TOKEN
 */
public record CompleteCheckoutRequest(
        @NotNull(message = "Payment method is required")
        PaymentMethod method,

        String token
) {
}
