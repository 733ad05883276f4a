package com.nosota.mescrow.error;

import lombok.Getter;

@Getter
public class InvalidResolutionException extends MarketplaceException {

    private final String resolution;

    public InvalidResolutionException(String resolution) {
        super("Invalid resolution: " + resolution);
        this.resolution = resolution;
    }
}
