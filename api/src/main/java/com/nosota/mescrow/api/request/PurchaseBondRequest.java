package com.nosota.mescrow.api.request;

import com.nosota.mescrow.api.model.SellerCategory;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for paying a seller bond from the wallet.
 *
 * @param category Category to unlock
 */
public record PurchaseBondRequest(
        @NotNull(message = "Category is required")
        SellerCategory category
) {
}
