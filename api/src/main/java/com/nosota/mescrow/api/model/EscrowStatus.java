package com.nosota.mescrow.api.model;

/**
 * Escrow status.
 *
 * <p>State diagram:
 * <pre>
 *            HELD
 *             |
 *     +-------+--------+
 *     |       |        |
 * RELEASED REFUNDED DISPUTED
 *                      |
 *                +-----+-----+
 *                |           |
 *            RELEASED    REFUNDED
 * </pre>
 *
 * <p>RELEASED and REFUNDED are final states.
 */
public enum EscrowStatus {
    /**
     * HELD: Buyer funds are held by the system, waiting for delivery confirmation
     * or the auto-release deadline.
     */
    HELD,

    /**
     * RELEASED: Funds were paid out to the seller (fully or, after a dispute, partially).
     */
    RELEASED,

    /**
     * REFUNDED: Funds were returned to the buyer in full.
     */
    REFUNDED,

    /**
     * DISPUTED: A dispute was opened; funds stay held until an adjudicator resolves it.
     * Auto-release never applies to disputed escrows.
     */
    DISPUTED
}
