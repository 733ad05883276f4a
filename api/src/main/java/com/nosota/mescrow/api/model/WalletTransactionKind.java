package com.nosota.mescrow.api.model;

/**
 * Kind of a wallet ledger entry.
 */
public enum WalletTransactionKind {
    /** Funds entering the wallet from the payment processor. */
    DEPOSIT,
    /** Funds leaving the wallet to an external invoice. */
    WITHDRAW,
    PAYMENT,
    RECEIPT,
    /** Marketplace fee charged at checkout. */
    FEE,
    /** Seller category bond. */
    BOND,
    /** Buyer funds moved into escrow. */
    ESCROW_HOLD,
    /** Escrowed funds paid out to the seller. */
    ESCROW_RELEASE,
    /** Escrowed funds returned to the buyer. */
    ESCROW_REFUND
}
