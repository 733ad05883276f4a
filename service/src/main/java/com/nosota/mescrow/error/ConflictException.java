package com.nosota.mescrow.error;

/**
 * Operation is not valid in the current state of the entity. Mapped to HTTP 409.
 */
public abstract class ConflictException extends MarketplaceException {

    protected ConflictException(String message) {
        super(message);
    }
}
