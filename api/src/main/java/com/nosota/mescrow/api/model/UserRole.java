package com.nosota.mescrow.api.model;

public enum UserRole {
    BUYER,
    SELLER,
    ADMIN
}
