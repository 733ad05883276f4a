package com.nosota.mescrow.controller;

import com.nosota.mescrow.api.WalletApi;
import com.nosota.mescrow.api.dto.PagedResponse;
import com.nosota.mescrow.api.dto.WalletTransactionDTO;
import com.nosota.mescrow.api.request.DepositInvoiceRequest;
import com.nosota.mescrow.api.request.DepositTokenRequest;
import com.nosota.mescrow.api.request.RegisterUserRequest;
import com.nosota.mescrow.api.request.WithdrawalRequest;
import com.nosota.mescrow.api.response.DepositInvoiceResponse;
import com.nosota.mescrow.api.response.UserWalletResponse;
import com.nosota.mescrow.error.InsufficientBalanceException;
import com.nosota.mescrow.error.PaymentFailedException;
import com.nosota.mescrow.error.UserNotFoundException;
import com.nosota.mescrow.mapper.MarketplaceMapper;
import com.nosota.mescrow.model.User;
import com.nosota.mescrow.model.WalletTransaction;
import com.nosota.mescrow.payment.DepositInvoice;
import com.nosota.mescrow.service.WalletFundingService;
import com.nosota.mescrow.service.WalletLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for wallets: registration, balance, history and funding.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class WalletController implements WalletApi {

    private final WalletLedgerService walletLedgerService;
    private final WalletFundingService walletFundingService;

    @Override
    public ResponseEntity<UserWalletResponse> registerUser(RegisterUserRequest request) {
        log.info("Registering user: userId={}, role={}", request.userId(), request.role());

        User user = walletLedgerService.registerUser(request.userId(), request.role());
        return ResponseEntity.status(HttpStatus.CREATED).body(MarketplaceMapper.INSTANCE.toWalletResponse(user));
    }

    @Override
    public ResponseEntity<UserWalletResponse> getWallet(String userId) throws UserNotFoundException {
        User user = walletLedgerService.getUser(userId);
        return ResponseEntity.ok(MarketplaceMapper.INSTANCE.toWalletResponse(user));
    }

    @Override
    public ResponseEntity<PagedResponse<WalletTransactionDTO>> getTransactions(String userId, int page, int size)
            throws UserNotFoundException {
        Page<WalletTransaction> history = walletLedgerService.getHistory(userId, page, size);

        PagedResponse<WalletTransactionDTO> response = new PagedResponse<>(
                MarketplaceMapper.INSTANCE.toDTOList(history.getContent()),
                page,
                size,
                history.getTotalElements()
        );
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<UserWalletResponse> depositToken(String userId, DepositTokenRequest request)
            throws PaymentFailedException, UserNotFoundException {
        log.info("Token deposit requested: userId={}", userId);

        walletFundingService.depositToken(userId, request.token());
        return ResponseEntity.ok(MarketplaceMapper.INSTANCE.toWalletResponse(walletLedgerService.getUser(userId)));
    }

    @Override
    public ResponseEntity<DepositInvoiceResponse> createDepositInvoice(String userId, DepositInvoiceRequest request)
            throws PaymentFailedException, UserNotFoundException {
        DepositInvoice invoice = walletFundingService.createDepositInvoice(userId, request.amount());

        DepositInvoiceResponse response = new DepositInvoiceResponse(
                invoice.paymentRequest(),
                invoice.paymentHash(),
                invoice.amount(),
                invoice.expiresAt()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    public ResponseEntity<UserWalletResponse> withdraw(String userId, WithdrawalRequest request)
            throws UserNotFoundException, InsufficientBalanceException, PaymentFailedException {
        log.info("Withdrawal requested: userId={}, amount={}", userId, request.amount());

        walletFundingService.withdraw(userId, request.invoice(), request.amount());
        return ResponseEntity.ok(MarketplaceMapper.INSTANCE.toWalletResponse(walletLedgerService.getUser(userId)));
    }
}
