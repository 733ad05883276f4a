package com.nosota.mescrow.api;

import com.nosota.mescrow.api.dto.PagedResponse;
import com.nosota.mescrow.api.dto.WalletTransactionDTO;
import com.nosota.mescrow.api.request.DepositInvoiceRequest;
import com.nosota.mescrow.api.request.DepositTokenRequest;
import com.nosota.mescrow.api.request.RegisterUserRequest;
import com.nosota.mescrow.api.request.WithdrawalRequest;
import com.nosota.mescrow.api.response.DepositInvoiceResponse;
import com.nosota.mescrow.api.response.UserWalletResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Wallet API interface.
 *
 * <p>Defines REST endpoints for:
 * <ul>
 *   <li>Registering users with the ledger</li>
 *   <li>Balance and transaction history queries</li>
 *   <li>Funding (token deposit, deposit invoice) and withdrawal</li>
 * </ul>
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>WalletController - in service module (server-side implementation)</li>
 *   <li>WalletClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/wallets")
public interface WalletApi {

    /**
     * Registers a user. Registering an existing user returns it unchanged.
     *
     * @param request User ID and role
     * @return Wallet of the user
     */
    @PostMapping("/users")
    ResponseEntity<UserWalletResponse> registerUser(@RequestBody @Valid RegisterUserRequest request);

    /**
     * Gets the wallet of a user.
     *
     * @param userId User ID
     * @return Wallet with current balance
     */
    @GetMapping("/users/{userId}")
    ResponseEntity<UserWalletResponse> getWallet(@PathVariable("userId") String userId) throws Exception;

    /**
     * Gets the wallet transaction history of a user, newest first.
     *
     * @param userId User ID
     * @param page   Page number (0-indexed)
     * @param size   Page size
     * @return Paginated ledger entries
     */
    @GetMapping("/users/{userId}/transactions")
    ResponseEntity<PagedResponse<WalletTransactionDTO>> getTransactions(
            @PathVariable("userId") String userId,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size) throws Exception;

    /**
     * Redeems a payment token and credits the redeemed amount.
     *
     * @param userId  User ID
     * @param request Token to redeem
     * @return Wallet with new balance
     */
    @PostMapping("/users/{userId}/deposit-token")
    ResponseEntity<UserWalletResponse> depositToken(
            @PathVariable("userId") String userId,
            @RequestBody @Valid DepositTokenRequest request) throws Exception;

    /**
     * Creates a payable deposit invoice.
     *
     * @param userId  User ID
     * @param request Invoice amount
     * @return Invoice reference
     */
    @PostMapping("/users/{userId}/deposit-invoice")
    ResponseEntity<DepositInvoiceResponse> createDepositInvoice(
            @PathVariable("userId") String userId,
            @RequestBody @Valid DepositInvoiceRequest request) throws Exception;

    /**
     * Withdraws funds to an external invoice.
     *
     * @param userId  User ID
     * @param request Invoice and amount
     * @return Wallet with new balance
     */
    @PostMapping("/users/{userId}/withdraw")
    ResponseEntity<UserWalletResponse> withdraw(
            @PathVariable("userId") String userId,
            @RequestBody @Valid WithdrawalRequest request) throws Exception;
}
