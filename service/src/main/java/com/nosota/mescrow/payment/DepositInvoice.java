package com.nosota.mescrow.payment;

import java.time.LocalDateTime;

/**
 * Payable invoice issued by the processor for a deposit.
 *
 * @param paymentRequest Invoice string shown to the payer
 * @param paymentHash    Processor-side identifier of the invoice
 * @param amount         Amount in sats
 * @param expiresAt      Moment after which the invoice can no longer be paid
 */
public record DepositInvoice(String paymentRequest, String paymentHash, long amount, LocalDateTime expiresAt) {
}
