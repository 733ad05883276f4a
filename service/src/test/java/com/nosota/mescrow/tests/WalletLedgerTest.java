package com.nosota.mescrow.tests;

import com.nosota.mescrow.TestBase;
import com.nosota.mescrow.api.model.UserRole;
import com.nosota.mescrow.api.model.WalletTransactionKind;
import com.nosota.mescrow.error.InsufficientBalanceException;
import com.nosota.mescrow.error.UserNotFoundException;
import com.nosota.mescrow.model.User;
import com.nosota.mescrow.model.WalletTransaction;
import com.nosota.mescrow.service.WalletLedgerService.Reconciliation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Page;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Wallet ledger")
public class WalletLedgerTest extends TestBase {

    @Test
    @DisplayName("WAL-001: Registering a user starts with a zero balance and is idempotent")
    void registerUser() throws Exception {
        String userId = "wallet-user-" + System.nanoTime();

        User first = walletLedgerService.registerUser(userId, UserRole.BUYER);
        User second = walletLedgerService.registerUser(userId, UserRole.SELLER);

        assertThat(first.getWalletBalance()).isZero();
        assertThat(second.getId()).isEqualTo(userId);
        assertThat(second.getRole()).isEqualTo(UserRole.BUYER);
    }

    @Test
    @DisplayName("WAL-002: Credit and debit move the balance and append signed entries")
    void creditAndDebit() throws Exception {
        // Arrange
        String userId = createBuyer(0);

        // Act
        long afterCredit = walletLedgerService.credit(userId, 1500, WalletTransactionKind.DEPOSIT, "dep-1");
        long afterDebit = walletLedgerService.debit(userId, 400, WalletTransactionKind.WITHDRAW, "wd-1");

        // Assert
        assertThat(afterCredit).isEqualTo(1500);
        assertThat(afterDebit).isEqualTo(1100);
        assertThat(balanceOf(userId)).isEqualTo(1100);

        WalletTransaction debitEntry = walletTransactionRepository.findByReferenceId("wd-1").get(0);
        assertThat(debitEntry.getAmount()).isEqualTo(-400);
        assertThat(debitEntry.getBalanceAfter()).isEqualTo(1100);
        assertThat(debitEntry.getKind()).isEqualTo(WalletTransactionKind.WITHDRAW);
    }

    @Test
    @DisplayName("WAL-003: Insufficient debit fails and changes nothing")
    void insufficientDebit() throws Exception {
        // Arrange
        String userId = createBuyer(300);
        long entriesBefore = walletTransactionRepository.countByUserId(userId);

        // Act & Assert
        assertThatThrownBy(() -> walletLedgerService.debit(userId, 301, WalletTransactionKind.WITHDRAW, "wd-x"))
                .isInstanceOf(InsufficientBalanceException.class)
                .satisfies(e -> {
                    InsufficientBalanceException ex = (InsufficientBalanceException) e;
                    assertThat(ex.getNeeded()).isEqualTo(301);
                    assertThat(ex.getAvailable()).isEqualTo(300);
                });

        assertThat(balanceOf(userId)).isEqualTo(300);
        assertThat(walletTransactionRepository.countByUserId(userId)).isEqualTo(entriesBefore);
    }

    @Test
    @DisplayName("WAL-004: Debiting the exact balance leaves zero")
    void debitExactBalance() throws Exception {
        String userId = createBuyer(250);

        long balance = walletLedgerService.debit(userId, 250, WalletTransactionKind.PAYMENT, null);

        assertThat(balance).isZero();
    }

    @Test
    @DisplayName("WAL-005: Operations on unknown users fail")
    void unknownUser() {
        assertThatThrownBy(() -> walletLedgerService.credit("ghost", 10, WalletTransactionKind.DEPOSIT, null))
                .isInstanceOf(UserNotFoundException.class);
        assertThatThrownBy(() -> walletLedgerService.getBalance("ghost"))
                .isInstanceOf(UserNotFoundException.class);
    }

    @Test
    @DisplayName("WAL-006: History is paged newest first")
    void historyNewestFirst() throws Exception {
        // Arrange
        String userId = createBuyer(0);
        walletLedgerService.credit(userId, 100, WalletTransactionKind.DEPOSIT, "h-1");
        clock.advance(Duration.ofMinutes(1));
        walletLedgerService.credit(userId, 200, WalletTransactionKind.DEPOSIT, "h-2");
        clock.advance(Duration.ofMinutes(1));
        walletLedgerService.debit(userId, 50, WalletTransactionKind.FEE, "h-3");

        // Act
        Page<WalletTransaction> firstPage = walletLedgerService.getHistory(userId, 0, 2);
        Page<WalletTransaction> secondPage = walletLedgerService.getHistory(userId, 1, 2);

        // Assert
        assertThat(firstPage.getTotalElements()).isEqualTo(3);
        assertThat(firstPage.getContent()).extracting(WalletTransaction::getReferenceId)
                .containsExactly("h-3", "h-2");
        assertThat(secondPage.getContent()).extracting(WalletTransaction::getReferenceId)
                .containsExactly("h-1");
    }

    @Test
    @DisplayName("WAL-007: Balance reconciles with the ledger")
    void reconcile() throws Exception {
        String userId = createBuyer(1000);
        walletLedgerService.debit(userId, 300, WalletTransactionKind.ESCROW_HOLD, "esc");
        walletLedgerService.credit(userId, 300, WalletTransactionKind.ESCROW_REFUND, "esc");

        Reconciliation result = walletLedgerService.reconcile(userId);

        assertThat(result.consistent()).isTrue();
        assertThat(result.balance()).isEqualTo(1000);
        assertThat(result.ledgerSum()).isEqualTo(1000);
    }

    @Test
    @DisplayName("WAL-008: Concurrent debits never overdraw the wallet")
    void concurrentDebits() throws Exception {
        // Arrange
        String userId = createBuyer(1000);
        int threads = 20;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startSignal = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        // Act
        for (int i = 0; i < threads; i++) {
            String reference = "concurrent-" + i;
            results.add(executor.submit(() -> {
                startSignal.await();
                try {
                    walletLedgerService.debit(userId, 100, WalletTransactionKind.PAYMENT, reference);
                    return true;
                } catch (InsufficientBalanceException e) {
                    return false;
                }
            }));
        }
        startSignal.countDown();

        int succeeded = 0;
        for (Future<Boolean> result : results) {
            if (result.get(30, TimeUnit.SECONDS)) {
                succeeded++;
            }
        }
        executor.shutdown();

        // Assert
        assertThat(succeeded).isEqualTo(10);
        assertThat(balanceOf(userId)).isZero();
        assertThat(walletLedgerService.reconcile(userId).consistent()).isTrue();
    }
}
