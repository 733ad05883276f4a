package com.nosota.mescrow.model;

public enum ListingStatus {
    ACTIVE,
    SOLD,
    INACTIVE
}
