package com.nosota.mescrow.model;

/**
 * Outcome of applying a {@link DisputeResolution} to an escrow amount.
 *
 * <p>{@code buyer + seller + destroyed} always equals the escrow amount.
 *
 * @param buyer     Amount credited back to the buyer
 * @param seller    Amount credited to the seller
 * @param destroyed Amount credited to nobody (burn, or split rounding remainder)
 */
public record ResolutionSplit(long buyer, long seller, long destroyed) {

    public long total() {
        return buyer + seller + destroyed;
    }
}
