package com.nosota.mescrow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Marketplace policy constants.
 *
 * <pre>
 * marketplace:
 *   fee-percent: 1            # platform fee on checkout total (integer division)
 *   escrow-hold-days: 10      # escrow auto-release delay
 *   price-lock-hours: 3       # checkout session lifetime
 *   dispute-window-days: 10   # dispute auto-resolve deadline
 *   dispute-warning-days: 7   # warn this long before auto-resolve
 * </pre>
 */
@ConfigurationProperties(prefix = "marketplace")
public record MarketplaceProperties(
        @DefaultValue("1") int feePercent,
        @DefaultValue("10") int escrowHoldDays,
        @DefaultValue("3") int priceLockHours,
        @DefaultValue("10") int disputeWindowDays,
        @DefaultValue("7") int disputeWarningDays
) {
}
