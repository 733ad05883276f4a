package com.nosota.mescrow.api.model;

/**
 * Listing category a seller posts a bond for. ALL covers the other three at a bundle price.
 */
public enum SellerCategory {
    DIGITAL,
    PHYSICAL,
    SERVICES,
    ALL
}
