package com.nosota.mescrow.error;

public class NotAuthorizedException extends MarketplaceException {

    public NotAuthorizedException(String message) {
        super(message);
    }
}
