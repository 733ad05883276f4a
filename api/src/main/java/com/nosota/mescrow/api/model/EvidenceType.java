package com.nosota.mescrow.api.model;

public enum EvidenceType {
    TEXT,
    IMAGE
}
