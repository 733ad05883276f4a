package com.nosota.mescrow.api.model;

/**
 * How a checkout session is paid.
 */
public enum PaymentMethod {
    /** Debit the buyer's wallet balance. */
    WALLET,
    /** Redeem an external payment token; surplus stays in the buyer's wallet. */
    TOKEN
}
