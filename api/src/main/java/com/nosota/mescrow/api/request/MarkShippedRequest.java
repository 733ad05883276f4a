package com.nosota.mescrow.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for marking an order as shipped.
 *
 * @param sellerId     Seller of the order
 * @param trackingInfo Optional carrier tracking information
 */
public record MarkShippedRequest(
        @NotBlank(message = "Seller is required")
        String sellerId,

        @Size(max = 500, message = "Tracking info must be at most 500 characters")
        String trackingInfo
) {
}
