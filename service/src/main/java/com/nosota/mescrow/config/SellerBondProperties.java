package com.nosota.mescrow.config;

import com.nosota.mescrow.api.model.SellerCategory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Seller bond prices in sats.
 *
 * <pre>
 * marketplace:
 *   seller-bonds:
 *     digital: 250000
 *     physical: 250000
 *     services: 250000
 *     all: 600000
 * </pre>
 */
@ConfigurationProperties(prefix = "marketplace.seller-bonds")
public record SellerBondProperties(
        @DefaultValue("250000") long digital,
        @DefaultValue("250000") long physical,
        @DefaultValue("250000") long services,
        @DefaultValue("600000") long all
) {

    public long bondFor(SellerCategory category) {
        return switch (category) {
            case DIGITAL -> digital;
            case PHYSICAL -> physical;
            case SERVICES -> services;
            case ALL -> all;
        };
    }
}
