package com.nosota.mescrow.service;

import com.nosota.mescrow.api.model.WalletTransactionKind;
import com.nosota.mescrow.error.InsufficientBalanceException;
import com.nosota.mescrow.error.PaymentFailedException;
import com.nosota.mescrow.error.UserNotFoundException;
import com.nosota.mescrow.payment.DepositInvoice;
import com.nosota.mescrow.payment.PaymentProcessor;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.UUID;

/**
 * Moves money between the external payment rail and wallets.
 *
 * <p>Deposits: the processor redeems first, then the wallet is credited (DEPOSIT).
 * Withdrawals: the wallet is debited first (WITHDRAW), then the processor pays; if the payout
 * fails the debit is rolled back.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class WalletFundingService {

    private final PaymentProcessor paymentProcessor;
    private final WalletLedgerService walletLedgerService;

    /**
     * Redeems a token and credits the full redeemed amount.
     *
     * <p>Runs in its own transaction: a redeemed token is spent at the processor, so the credit
     * must survive even if the caller's transaction later rolls back.
     *
     * @param userId User to credit
     * @param token  Payment token
     * @return Amount credited
     * @throws PaymentFailedException if the processor rejects the token
     * @throws UserNotFoundException  if the user does not exist
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW, rollbackFor = Exception.class)
    public long depositToken(@NotBlank String userId, @NotBlank String token)
            throws PaymentFailedException, UserNotFoundException {
        walletLedgerService.requireUser(userId);
        return creditRedeemed(userId, paymentProcessor.redeemToken(token));
    }

    public DepositInvoice createDepositInvoice(@NotBlank String userId, @Positive long amount)
            throws PaymentFailedException, UserNotFoundException {
        walletLedgerService.requireUser(userId);

        DepositInvoice invoice = paymentProcessor.createInvoice(amount);
        log.info("Deposit invoice created: userId={}, amount={}, paymentHash={}",
                userId, amount, invoice.paymentHash());
        return invoice;
    }

    /**
     * Withdraws to an external invoice.
     *
     * @param userId  User to debit
     * @param invoice Payable invoice
     * @param amount  Amount in sats
     * @return New balance
     * @throws InsufficientBalanceException if the balance does not cover {@code amount}
     * @throws PaymentFailedException       if the payout fails (the debit is rolled back)
     */
    @Transactional(rollbackFor = Exception.class)
    public long withdraw(@NotBlank String userId, @NotBlank String invoice, @Positive long amount)
            throws UserNotFoundException, InsufficientBalanceException, PaymentFailedException {
        String referenceId = "withdraw-" + UUID.randomUUID();
        long balance = walletLedgerService.debit(userId, amount, WalletTransactionKind.WITHDRAW,
                referenceId, "Withdrawal to invoice");

        paymentProcessor.payInvoice(invoice, amount);

        log.info("Withdrawal completed: userId={}, amount={}, referenceId={}, balance={}",
                userId, amount, referenceId, balance);
        return balance;
    }

    private long creditRedeemed(String userId, long amount) throws UserNotFoundException {
        long balance = walletLedgerService.credit(userId, amount, WalletTransactionKind.DEPOSIT,
                "token-" + UUID.randomUUID(), "Token deposit");
        log.info("Token deposit completed: userId={}, amount={}, balance={}", userId, amount, balance);
        return amount;
    }
}
