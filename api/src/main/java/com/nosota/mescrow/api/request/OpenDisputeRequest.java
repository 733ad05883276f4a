package com.nosota.mescrow.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

/**
 * Request DTO for opening a dispute on an order.
 *
 * @param orderId     Order being disputed
 * @param initiatorId User opening the dispute
 * @param reason      Reason for the dispute (max 2000 characters)
 */
public record OpenDisputeRequest(
        @NotNull(message = "Order ID is required")
        UUID orderId,

        @NotBlank(message = "Initiator is required")
        String initiatorId,

        @NotBlank(message = "Reason is required")
        @Size(max = 2000, message = "Reason must be at most 2000 characters")
        String reason
) {
}
