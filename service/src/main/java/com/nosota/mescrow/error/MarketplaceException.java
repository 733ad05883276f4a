package com.nosota.mescrow.error;

/**
 * Base class of all domain errors raised by the escrow core.
 *
 * <p>Checked on purpose: every caller of a money-moving operation has to decide what a
 * failed transfer means for it. Services roll back on any of these.
 */
public abstract class MarketplaceException extends Exception {

    protected MarketplaceException(String message) {
        super(message);
    }

    protected MarketplaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
