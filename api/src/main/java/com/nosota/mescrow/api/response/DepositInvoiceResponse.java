package com.nosota.mescrow.api.response;

import java.time.LocalDateTime;

/**
 * Payable invoice returned by the payment processor for a deposit.
 *
 * @param paymentRequest Invoice to be paid by the depositor
 * @param paymentHash    Processor-side reference of the invoice
 * @param amount         Invoice amount in sats
 * @param expiresAt      Invoice expiry
 */
public record DepositInvoiceResponse(
        String paymentRequest,
        String paymentHash,
        Long amount,
        LocalDateTime expiresAt
) {}
