package com.nosota.mescrow.api.model;

/**
 * Dispute status. RESOLVED is final.
 */
public enum DisputeStatus {
    OPEN,
    RESOLVED
}
