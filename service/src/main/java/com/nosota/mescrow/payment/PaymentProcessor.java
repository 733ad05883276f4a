package com.nosota.mescrow.payment;

import com.nosota.mescrow.error.PaymentFailedException;

/**
 * External payment rail (ecash mint, Lightning node).
 *
 * <p>The escrow core never holds external money itself: it asks the processor to turn a
 * token into sats before crediting a wallet, and to pay an invoice after debiting one.
 */
public interface PaymentProcessor {

    /**
     * Redeems a bearer token. A token can be redeemed only once.
     *
     * @param token Serialized token
     * @return Amount redeemed, in sats
     * @throws PaymentFailedException if the token is malformed, unknown or already spent
     */
    long redeemToken(String token) throws PaymentFailedException;

    /**
     * Creates an invoice that, once paid, funds a deposit of {@code amount} sats.
     *
     * @throws PaymentFailedException if the processor cannot issue invoices
     */
    DepositInvoice createInvoice(long amount) throws PaymentFailedException;

    /**
     * Pays an external invoice.
     *
     * @param invoice Payment request
     * @param amount  Amount in sats
     * @throws PaymentFailedException if the payment did not go through
     */
    void payInvoice(String invoice, long amount) throws PaymentFailedException;
}
