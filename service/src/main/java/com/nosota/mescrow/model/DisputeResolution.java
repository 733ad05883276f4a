package com.nosota.mescrow.model;

import com.nosota.mescrow.error.InvalidResolutionException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adjudicator decision on a disputed escrow.
 *
 * <p>String form (used on the wire and in storage):
 * <ul>
 *   <li>{@code buyer_full} - whole amount back to the buyer</li>
 *   <li>{@code seller_full} - whole amount to the seller</li>
 *   <li>{@code split_<b>_<s>} - b% to the buyer, s% to the seller, b + s = 100</li>
 *   <li>{@code burn} - nobody is credited</li>
 * </ul>
 *
 * <p>Split shares are rounded down; the remainder is destroyed.
 */
public record DisputeResolution(Type type, int buyerPercent, int sellerPercent) {

    public enum Type {
        BUYER_FULL,
        SELLER_FULL,
        SPLIT,
        BURN
    }

    public static final DisputeResolution BUYER_FULL = new DisputeResolution(Type.BUYER_FULL, 100, 0);
    public static final DisputeResolution SELLER_FULL = new DisputeResolution(Type.SELLER_FULL, 0, 100);
    public static final DisputeResolution BURN = new DisputeResolution(Type.BURN, 0, 0);

    private static final Pattern SPLIT_PATTERN = Pattern.compile("split_(\\d{1,3})_(\\d{1,3})");

    public DisputeResolution {
        if (type == null) {
            throw new IllegalArgumentException("Resolution type is required");
        }
        if (buyerPercent < 0 || sellerPercent < 0) {
            throw new IllegalArgumentException("Percentages must not be negative");
        }
        if (type != Type.BURN && buyerPercent + sellerPercent != 100) {
            throw new IllegalArgumentException(
                    "Percentages must sum to 100: buyer=" + buyerPercent + ", seller=" + sellerPercent);
        }
    }

    /**
     * Creates a split resolution.
     *
     * @throws InvalidResolutionException if the percentages do not sum to 100
     */
    public static DisputeResolution split(int buyerPercent, int sellerPercent) throws InvalidResolutionException {
        if (buyerPercent < 0 || sellerPercent < 0 || buyerPercent + sellerPercent != 100) {
            throw new InvalidResolutionException("split_" + buyerPercent + "_" + sellerPercent);
        }
        return new DisputeResolution(Type.SPLIT, buyerPercent, sellerPercent);
    }

    /**
     * Parses the string form.
     *
     * @param value Resolution string
     * @return Parsed resolution
     * @throws InvalidResolutionException carrying {@code value} if it is not well formed
     */
    public static DisputeResolution parse(String value) throws InvalidResolutionException {
        if (value == null) {
            throw new InvalidResolutionException(null);
        }

        switch (value) {
            case "buyer_full":
                return BUYER_FULL;
            case "seller_full":
                return SELLER_FULL;
            case "burn":
                return BURN;
            default:
                break;
        }

        Matcher matcher = SPLIT_PATTERN.matcher(value);
        if (!matcher.matches()) {
            throw new InvalidResolutionException(value);
        }

        int buyer = Integer.parseInt(matcher.group(1));
        int seller = Integer.parseInt(matcher.group(2));
        if (buyer + seller != 100) {
            throw new InvalidResolutionException(value);
        }
        return new DisputeResolution(Type.SPLIT, buyer, seller);
    }

    /**
     * Splits an escrow amount according to this resolution.
     *
     * @param amount Escrow amount (positive)
     * @return Buyer, seller and destroyed amounts summing to {@code amount}
     */
    public ResolutionSplit apply(long amount) {
        switch (type) {
            case BUYER_FULL:
                return new ResolutionSplit(amount, 0, 0);
            case SELLER_FULL:
                return new ResolutionSplit(0, amount, 0);
            case BURN:
                return new ResolutionSplit(0, 0, amount);
            default:
                long buyer = amount * buyerPercent / 100;
                long seller = amount * sellerPercent / 100;
                return new ResolutionSplit(buyer, seller, amount - buyer - seller);
        }
    }

    /**
     * Whether the outcome returns the whole amount to the buyer (escrow and order end up REFUNDED).
     */
    public boolean isFullRefund() {
        return type == Type.BUYER_FULL;
    }

    public String asString() {
        switch (type) {
            case BUYER_FULL:
                return "buyer_full";
            case SELLER_FULL:
                return "seller_full";
            case BURN:
                return "burn";
            default:
                return "split_" + buyerPercent + "_" + sellerPercent;
        }
    }

    @Override
    public String toString() {
        return asString();
    }
}
