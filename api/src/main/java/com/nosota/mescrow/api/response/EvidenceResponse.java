package com.nosota.mescrow.api.response;

import com.nosota.mescrow.api.model.EvidenceType;

import java.time.LocalDateTime;
import java.util.UUID;

public record EvidenceResponse(
        UUID id,
        UUID disputeId,
        String submittedBy,
        EvidenceType type,
        String content,
        LocalDateTime createdAt
) {}
