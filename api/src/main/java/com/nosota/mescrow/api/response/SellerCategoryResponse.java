package com.nosota.mescrow.api.response;

import com.nosota.mescrow.api.model.SellerCategory;

import java.time.LocalDateTime;

/**
 * A category a seller has paid a bond for.
 */
public record SellerCategoryResponse(
        SellerCategory category,
        Long bondPaid,
        LocalDateTime paidAt
) {}
