package com.nosota.mescrow.error;

/**
 * Payment processor rejected a token, invoice or payout.
 */
public class PaymentFailedException extends MarketplaceException {

    public PaymentFailedException(String message) {
        super(message);
    }

    public PaymentFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
