package com.nosota.mescrow.error;

/**
 * Referenced entity does not exist. Mapped to HTTP 404.
 */
public abstract class NotFoundException extends MarketplaceException {

    protected NotFoundException(String message) {
        super(message);
    }
}
