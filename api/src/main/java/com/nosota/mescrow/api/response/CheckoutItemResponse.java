package com.nosota.mescrow.api.response;

import java.util.UUID;

public record CheckoutItemResponse(
        UUID id,
        UUID listingId,
        String sellerId,
        Long lockedPrice
) {}
