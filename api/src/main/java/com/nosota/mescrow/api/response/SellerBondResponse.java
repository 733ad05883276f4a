package com.nosota.mescrow.api.response;

import com.nosota.mescrow.api.model.UserRole;

import java.util.List;

/**
 * Result of a bond payment: the debited amount, the user's role afterwards
 * and every category the user now holds.
 */
public record SellerBondResponse(
        String userId,
        UserRole role,
        Long bondPaid,
        Long walletBalance,
        List<SellerCategoryResponse> categories
) {}
