package com.nosota.mescrow.api.request;

import com.nosota.mescrow.api.model.EvidenceType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for attaching evidence to an open dispute.
 *
 * @param submitterId User submitting the evidence
 * @param type        TEXT or IMAGE (base64 content)
 * @param content     Evidence body
 */
public record SubmitEvidenceRequest(
        @NotBlank(message = "Submitter is required")
        String submitterId,

        @NotNull(message = "Evidence type is required")
        EvidenceType type,

        @NotBlank(message = "Content is required")
        String content
) {
}
