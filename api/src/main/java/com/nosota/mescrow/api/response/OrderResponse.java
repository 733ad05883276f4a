package com.nosota.mescrow.api.response;

import com.nosota.mescrow.api.model.OrderStatus;

import java.time.LocalDateTime;
import java.util.UUID;

public record OrderResponse(
        UUID id,
        UUID checkoutId,
        String buyerId,
        String sellerId,
        UUID escrowId,
        OrderStatus status,
        String trackingInfo,
        LocalDateTime shippedAt,
        LocalDateTime completedAt,
        LocalDateTime createdAt
) {}
