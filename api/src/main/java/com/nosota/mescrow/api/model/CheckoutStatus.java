package com.nosota.mescrow.api.model;

/**
 * Checkout session status.
 *
 * <p>Sessions are not expired proactively: a PENDING session past its
 * {@code expiresAt} is treated as expired when it is used and only then marked EXPIRED.
 */
public enum CheckoutStatus {
    PENDING,
    PAID,
    EXPIRED
}
