package com.nosota.mescrow.api.model;

/**
 * Order status. An order is bound 1:1 to an escrow.
 */
public enum OrderStatus {
    PENDING,
    SHIPPED,
    COMPLETED,
    DISPUTED,
    REFUNDED
}
