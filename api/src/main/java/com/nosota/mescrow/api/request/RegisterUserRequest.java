package com.nosota.mescrow.api.request;

import com.nosota.mescrow.api.model.UserRole;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for registering a user with the ledger.
 *
 * @param userId Stable public identifier supplied by the identity collaborator
 * @param role   Role of the user (BUYER, SELLER, ADMIN)
 */
public record RegisterUserRequest(
        @NotBlank(message = "User ID is required")
        @Size(max = 128, message = "User ID must be at most 128 characters")
        String userId,

        @NotNull(message = "Role is required")
        UserRole role
) {
}
