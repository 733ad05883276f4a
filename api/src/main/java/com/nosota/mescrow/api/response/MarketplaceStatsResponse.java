package com.nosota.mescrow.api.response;

/**
 * Admin dashboard figures.
 *
 * @param openDisputes    Number of disputes in OPEN status
 * @param totalEscrowHeld Sum of amounts of escrows in HELD or DISPUTED status (sats)
 */
public record MarketplaceStatsResponse(
        Long openDisputes,
        Long totalEscrowHeld
) {}
