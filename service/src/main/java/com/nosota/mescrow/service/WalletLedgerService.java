package com.nosota.mescrow.service;

import com.nosota.mescrow.api.model.UserRole;
import com.nosota.mescrow.api.model.WalletTransactionKind;
import com.nosota.mescrow.error.InsufficientBalanceException;
import com.nosota.mescrow.error.UserNotFoundException;
import com.nosota.mescrow.model.User;
import com.nosota.mescrow.model.WalletTransaction;
import com.nosota.mescrow.repository.UserRepository;
import com.nosota.mescrow.repository.WalletTransactionRepository;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.TreeSet;

/**
 * Per-user wallet ledger.
 *
 * <p>Every balance mutation:
 * <ol>
 *   <li>locks the user row ({@code SELECT ... FOR UPDATE})</li>
 *   <li>writes the new balance</li>
 *   <li>appends exactly one {@link WalletTransaction} with the signed delta and the resulting balance</li>
 * </ol>
 * all inside the caller's transaction, so a failure anywhere later in that transaction
 * rolls back both the balance and the entry.
 *
 * <p>A balance can never go negative: a debit larger than the balance fails with
 * {@link InsufficientBalanceException} and changes nothing.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class WalletLedgerService {

    private final UserRepository userRepository;
    private final WalletTransactionRepository walletTransactionRepository;
    private final Clock clock;

    /**
     * Registers a user with a zero balance. Registering an existing ID returns the existing user.
     *
     * @param userId User ID
     * @param role   Role of the user
     * @return Registered (or already existing) user
     */
    @Transactional(rollbackFor = Exception.class)
    public User registerUser(@NotBlank String userId, @NotNull UserRole role) {
        return userRepository.findById(userId).orElseGet(() -> {
            User user = new User();
            user.setId(userId);
            user.setRole(role);
            user.setWalletBalance(0L);
            user.setCreatedAt(LocalDateTime.now(clock));

            User saved = userRepository.save(user);
            log.info("Registered user: userId={}, role={}", userId, role);
            return saved;
        });
    }

    /**
     * Adds {@code amount} to the user's balance.
     *
     * @param userId      User to credit
     * @param amount      Positive amount in sats
     * @param kind        Ledger entry kind
     * @param referenceId Escrow, session or payment the entry belongs to (nullable)
     * @return New balance
     * @throws UserNotFoundException if the user does not exist
     */
    @Transactional(rollbackFor = Exception.class)
    public long credit(@NotBlank String userId, @Positive long amount,
                       @NotNull WalletTransactionKind kind, String referenceId) throws UserNotFoundException {
        return credit(userId, amount, kind, referenceId, null);
    }

    @Transactional(rollbackFor = Exception.class)
    public long credit(@NotBlank String userId, @Positive long amount,
                       @NotNull WalletTransactionKind kind, String referenceId,
                       String description) throws UserNotFoundException {
        User user = lockUser(userId);

        long newBalance = Math.addExact(user.getWalletBalance(), amount);
        user.setWalletBalance(newBalance);
        appendEntry(userId, kind, amount, newBalance, referenceId, description);

        log.info("Credited wallet: userId={}, amount={}, kind={}, referenceId={}, balance={}",
                userId, amount, kind, referenceId, newBalance);
        return newBalance;
    }

    /**
     * Subtracts {@code amount} from the user's balance.
     *
     * @param userId      User to debit
     * @param amount      Positive amount in sats
     * @param kind        Ledger entry kind
     * @param referenceId Escrow, session or payment the entry belongs to (nullable)
     * @return New balance
     * @throws UserNotFoundException        if the user does not exist
     * @throws InsufficientBalanceException if the balance is lower than {@code amount}
     */
    @Transactional(rollbackFor = Exception.class)
    public long debit(@NotBlank String userId, @Positive long amount,
                      @NotNull WalletTransactionKind kind, String referenceId)
            throws UserNotFoundException, InsufficientBalanceException {
        return debit(userId, amount, kind, referenceId, null);
    }

    @Transactional(rollbackFor = Exception.class)
    public long debit(@NotBlank String userId, @Positive long amount,
                      @NotNull WalletTransactionKind kind, String referenceId,
                      String description) throws UserNotFoundException, InsufficientBalanceException {
        User user = lockUser(userId);

        long balance = user.getWalletBalance();
        if (balance < amount) {
            log.info("Debit rejected, insufficient balance: userId={}, amount={}, balance={}",
                    userId, amount, balance);
            throw new InsufficientBalanceException(amount, balance);
        }

        long newBalance = balance - amount;
        user.setWalletBalance(newBalance);
        appendEntry(userId, kind, -amount, newBalance, referenceId, description);

        log.info("Debited wallet: userId={}, amount={}, kind={}, referenceId={}, balance={}",
                userId, amount, kind, referenceId, newBalance);
        return newBalance;
    }

    /**
     * Locks the user's wallet for the rest of the current transaction and returns its balance.
     *
     * <p>Used by multi-step flows that check affordability before a series of debits.
     */
    @Transactional(rollbackFor = Exception.class)
    public long lockBalance(@NotBlank String userId) throws UserNotFoundException {
        return lockUser(userId).getWalletBalance();
    }

    /**
     * Locks several wallets for the rest of the current transaction, in ascending ID order.
     * Flows that credit more than one user take their locks here first so that two of them
     * touching the same pair of users cannot deadlock.
     */
    @Transactional(rollbackFor = Exception.class)
    public void lockUsers(@NotNull String... userIds) throws UserNotFoundException {
        for (String userId : new TreeSet<>(Arrays.asList(userIds))) {
            lockUser(userId);
        }
    }

    /**
     * Gives a BUYER the SELLER role. SELLER and ADMIN are left as they are.
     *
     * @return Role after the call
     */
    @Transactional(rollbackFor = Exception.class)
    public UserRole promoteToSeller(@NotBlank String userId) throws UserNotFoundException {
        User user = lockUser(userId);
        if (user.getRole() == UserRole.BUYER) {
            user.setRole(UserRole.SELLER);
            log.info("Promoted user to seller: userId={}", userId);
        }
        return user.getRole();
    }

    /**
     * Fails unless the user exists. Does not load the user, so a later lock in the same
     * transaction reads the current balance.
     */
    @Transactional(readOnly = true)
    public void requireUser(@NotBlank String userId) throws UserNotFoundException {
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
    }

    @Transactional(readOnly = true)
    public long getBalance(@NotBlank String userId) throws UserNotFoundException {
        return getUser(userId).getWalletBalance();
    }

    @Transactional(readOnly = true)
    public User getUser(@NotBlank String userId) throws UserNotFoundException {
        return userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
    }

    /**
     * Ledger entries of a user, newest first.
     */
    @Transactional(readOnly = true)
    public Page<WalletTransaction> getHistory(@NotBlank String userId, int page, int size) throws UserNotFoundException {
        requireUser(userId);
        return walletTransactionRepository.findByUserIdOrderByCreatedAtDescIdDesc(userId, PageRequest.of(page, size));
    }

    /**
     * Compares the stored balance with the sum of the user's ledger entries.
     *
     * @return Reconciliation result; {@link Reconciliation#consistent()} is false on drift
     */
    @Transactional(readOnly = true)
    public Reconciliation reconcile(@NotBlank String userId) throws UserNotFoundException {
        User user = getUser(userId);
        long ledgerSum = walletTransactionRepository.sumAmountByUserId(userId);

        Reconciliation result = new Reconciliation(userId, user.getWalletBalance(), ledgerSum);
        if (!result.consistent()) {
            log.warn("Ledger drift detected: userId={}, balance={}, ledgerSum={}",
                    userId, result.balance(), result.ledgerSum());
        }
        return result;
    }

    private User lockUser(String userId) throws UserNotFoundException {
        return userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
    }

    private void appendEntry(String userId, WalletTransactionKind kind, long amount, long balanceAfter,
                             String referenceId, String description) {
        WalletTransaction entry = new WalletTransaction();
        entry.setUserId(userId);
        entry.setKind(kind);
        entry.setAmount(amount);
        entry.setBalanceAfter(balanceAfter);
        entry.setReferenceId(referenceId);
        entry.setDescription(description);
        entry.setCreatedAt(LocalDateTime.now(clock));
        walletTransactionRepository.save(entry);
    }

    /**
     * Result of {@link #reconcile(String)}.
     */
    public record Reconciliation(String userId, long balance, long ledgerSum) {

        public boolean consistent() {
            return balance == ledgerSum;
        }
    }
}
