package com.nosota.mescrow.api.response;

import com.nosota.mescrow.api.model.UserRole;

import java.time.LocalDateTime;

/**
 * Response for user wallet queries.
 */
public record UserWalletResponse(
        String id,
        UserRole role,
        Long walletBalance,
        LocalDateTime createdAt
) {}
