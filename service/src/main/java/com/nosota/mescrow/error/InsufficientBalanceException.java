package com.nosota.mescrow.error;

import lombok.Getter;

/**
 * Wallet (or redeemed token) does not cover the requested amount.
 */
@Getter
public class InsufficientBalanceException extends MarketplaceException {

    private final long needed;
    private final long available;

    public InsufficientBalanceException(long needed, long available) {
        super("Insufficient balance: needed=" + needed + ", available=" + available);
        this.needed = needed;
        this.available = available;
    }
}
