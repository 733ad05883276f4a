package com.nosota.mescrow.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for resolving a dispute.
 *
 * <p>Adjudicator privilege is checked by the caller before this request is sent.
 *
 * @param resolution   One of {@code buyer_full}, {@code seller_full}, {@code burn}, {@code split_<b>_<s>}
 * @param adjudicatorId User resolving the dispute
 * @param notes        Optional resolution notes
 */
public record ResolveDisputeRequest(
        @NotBlank(message = "Resolution is required")
        String resolution,

        @NotBlank(message = "Adjudicator is required")
        String adjudicatorId,

        @Size(max = 2000, message = "Notes must be at most 2000 characters")
        String notes
) {
}
