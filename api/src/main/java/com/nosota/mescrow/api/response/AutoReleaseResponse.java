package com.nosota.mescrow.api.response;

/**
 * Result of one auto-release sweep.
 */
public record AutoReleaseResponse(
        Integer releasedCount
) {}
