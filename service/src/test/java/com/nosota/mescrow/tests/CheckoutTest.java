package com.nosota.mescrow.tests;

import com.nosota.mescrow.TestBase;
import com.nosota.mescrow.api.model.CheckoutStatus;
import com.nosota.mescrow.api.model.EscrowStatus;
import com.nosota.mescrow.api.model.OrderStatus;
import com.nosota.mescrow.api.model.PaymentMethod;
import com.nosota.mescrow.api.model.WalletTransactionKind;
import com.nosota.mescrow.error.CartEmptyException;
import com.nosota.mescrow.error.InsufficientBalanceException;
import com.nosota.mescrow.error.PaymentFailedException;
import com.nosota.mescrow.error.PriceLockExpiredException;
import com.nosota.mescrow.model.CheckoutItem;
import com.nosota.mescrow.model.CheckoutSession;
import com.nosota.mescrow.model.Escrow;
import com.nosota.mescrow.model.Listing;
import com.nosota.mescrow.model.ListingStatus;
import com.nosota.mescrow.model.Order;
import com.nosota.mescrow.model.OrderItem;
import com.nosota.mescrow.model.WalletTransaction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Checkout: price lock, payment and the per-seller split into escrows and orders.
 */
@DisplayName("Checkout price lock")
public class CheckoutTest extends TestBase {

    @Test
    @DisplayName("CHK-001: Starting checkout locks prices and computes the fee")
    void startLocksPrices() throws Exception {
        // Arrange
        String buyer = createBuyer(0);
        String seller = createSeller();
        addToCart(buyer, createListing(seller, 600));
        addToCart(buyer, createListing(seller, 400));

        // Act
        CheckoutSession session = checkoutService.start(buyer);

        // Assert
        assertThat(session.getStatus()).isEqualTo(CheckoutStatus.PENDING);
        assertThat(session.getTotalAmount()).isEqualTo(1000);
        assertThat(session.getFeeAmount()).isEqualTo(10);
        assertThat(session.getExpiresAt()).isEqualTo(session.getCreatedAt().plusHours(3));
        assertThat(checkoutService.getItems(session.getId())).extracting(CheckoutItem::getLockedPrice)
                .containsExactlyInAnyOrder(600L, 400L);
    }

    @Test
    @DisplayName("CHK-002: Fee uses integer division")
    void feeRoundsDown() throws Exception {
        String buyer = createBuyer(0);
        addToCart(buyer, createListing(createSeller(), 199));

        CheckoutSession session = checkoutService.start(buyer);

        assertThat(session.getFeeAmount()).isEqualTo(1);
    }

    @Test
    @DisplayName("CHK-003: A pending session is reused while the lock holds")
    void startReturnsPendingSession() throws Exception {
        String buyer = createBuyer(0);
        addToCart(buyer, createListing(createSeller(), 100));

        CheckoutSession first = checkoutService.start(buyer);
        CheckoutSession second = checkoutService.start(buyer);

        assertThat(second.getId()).isEqualTo(first.getId());
    }

    @Test
    @DisplayName("CHK-004: Empty cart and unavailable listings are rejected")
    void emptyCart() throws Exception {
        String buyer = createBuyer(0);
        assertThatThrownBy(() -> checkoutService.start(buyer)).isInstanceOf(CartEmptyException.class);

        Listing sold = createListing(createSeller(), 100);
        sold.setStatus(ListingStatus.SOLD);
        listingRepository.save(sold);
        addToCart(buyer, sold);

        assertThatThrownBy(() -> checkoutService.start(buyer)).isInstanceOf(CartEmptyException.class);
    }

    @Test
    @DisplayName("CHK-005: Locked price is charged even if the listing price changes")
    void lockedPriceCharged() throws Exception {
        // Arrange
        String buyer = createBuyer(5000);
        String seller = createSeller();
        Listing listing = createListing(seller, 1000);
        addToCart(buyer, listing);
        CheckoutSession session = checkoutService.start(buyer);

        listing.setPrice(3000L);
        listingRepository.save(listing);

        // Act
        List<Order> orders = checkoutService.complete(session.getId(), PaymentMethod.WALLET, null);

        // Assert
        Escrow escrow = escrowService.getEscrow(orders.get(0).getEscrowId());
        assertThat(escrow.getAmount()).isEqualTo(1000);
        assertThat(balanceOf(buyer)).isEqualTo(5000 - 1000 - 10);
    }

    @Test
    @DisplayName("CHK-006: Expired lock is rejected and the session marked EXPIRED")
    void expiredLock() throws Exception {
        // Arrange
        String buyer = createBuyer(5000);
        addToCart(buyer, createListing(createSeller(), 1000));
        CheckoutSession session = checkoutService.start(buyer);

        // Act
        clock.advance(Duration.ofHours(3).plusMinutes(1));

        // Assert
        assertThatThrownBy(() -> checkoutService.complete(session.getId(), PaymentMethod.WALLET, null))
                .isInstanceOf(PriceLockExpiredException.class);
        assertThat(checkoutService.getSession(session.getId()).getStatus()).isEqualTo(CheckoutStatus.EXPIRED);
        assertThat(balanceOf(buyer)).isEqualTo(5000);

        CheckoutSession renewed = checkoutService.start(buyer);
        assertThat(renewed.getId()).isNotEqualTo(session.getId());
    }

    @Test
    @DisplayName("CHK-007: A paid session cannot be paid again")
    void paidSessionRejected() throws Exception {
        String buyer = createBuyer(5000);
        addToCart(buyer, createListing(createSeller(), 1000));
        CheckoutSession session = checkoutService.start(buyer);
        checkoutService.complete(session.getId(), PaymentMethod.WALLET, null);

        assertThatThrownBy(() -> checkoutService.complete(session.getId(), PaymentMethod.WALLET, null))
                .isInstanceOf(PriceLockExpiredException.class);
        assertThat(checkoutService.getSession(session.getId()).getStatus()).isEqualTo(CheckoutStatus.PAID);
        assertThat(balanceOf(buyer)).isEqualTo(3990);
    }

    @Test
    @DisplayName("CHK-008: Two sellers produce two escrows and orders, fee charged once")
    void multiSellerCheckout() throws Exception {
        // Arrange
        String buyer = createBuyer(10_000);
        String sellerA = createSeller();
        String sellerB = createSeller();
        addToCart(buyer, createListing(sellerA, 1000));
        addToCart(buyer, createListing(sellerA, 500));
        addToCart(buyer, createListing(sellerB, 2500));
        CheckoutSession session = checkoutService.start(buyer);

        // Act
        List<Order> orders = checkoutService.complete(session.getId(), PaymentMethod.WALLET, null);

        // Assert
        assertThat(orders).hasSize(2);
        assertThat(orders).extracting(Order::getSellerId).containsExactlyInAnyOrder(sellerA, sellerB);
        assertThat(orders).allSatisfy(order -> {
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(order.getCheckoutId()).isEqualTo(session.getId());
        });

        Order orderA = orders.stream().filter(o -> o.getSellerId().equals(sellerA)).findFirst().orElseThrow();
        Order orderB = orders.stream().filter(o -> o.getSellerId().equals(sellerB)).findFirst().orElseThrow();
        assertThat(escrowService.getEscrow(orderA.getEscrowId()).getAmount()).isEqualTo(1500);
        assertThat(escrowService.getEscrow(orderB.getEscrowId()).getAmount()).isEqualTo(2500);
        assertThat(escrowService.getEscrow(orderA.getEscrowId()).getStatus()).isEqualTo(EscrowStatus.HELD);
        assertThat(orderService.getItems(orderA.getId())).extracting(OrderItem::getPrice)
                .containsExactlyInAnyOrder(1000L, 500L);

        assertThat(balanceOf(buyer)).isEqualTo(10_000 - 4000 - 40);
        assertThat(walletTransactionRepository.findByReferenceIdAndKind(
                session.getId().toString(), WalletTransactionKind.FEE)).hasSize(1);
        assertThat(walletLedgerService.reconcile(buyer).consistent()).isTrue();
        assertThat(cartItemRepository.findByUserIdOrderByAddedAtAsc(buyer)).isEmpty();
        assertThat(checkoutService.getSession(session.getId()).getStatus()).isEqualTo(CheckoutStatus.PAID);
    }

    @Test
    @DisplayName("CHK-009: Wallet payment without funds changes nothing")
    void walletInsufficient() throws Exception {
        String buyer = createBuyer(1009);
        addToCart(buyer, createListing(createSeller(), 1000));
        CheckoutSession session = checkoutService.start(buyer);

        assertThatThrownBy(() -> checkoutService.complete(session.getId(), PaymentMethod.WALLET, null))
                .isInstanceOf(InsufficientBalanceException.class);

        assertThat(balanceOf(buyer)).isEqualTo(1009);
        assertThat(checkoutService.getSession(session.getId()).getStatus()).isEqualTo(CheckoutStatus.PENDING);
        assertThat(cartItemRepository.findByUserIdOrderByAddedAtAsc(buyer)).hasSize(1);
    }

    @Test
    @DisplayName("CHK-010: Token overpayment leaves the surplus in the wallet")
    void tokenOverpayment() throws Exception {
        // Arrange
        String buyer = createBuyer(0);
        addToCart(buyer, createListing(createSeller(), 1000));
        CheckoutSession session = checkoutService.start(buyer);
        String token = mockPaymentProcessor.issueToken(1500);

        // Act
        List<Order> orders = checkoutService.complete(session.getId(), PaymentMethod.TOKEN, token);

        // Assert
        assertThat(orders).hasSize(1);
        assertThat(balanceOf(buyer)).isEqualTo(1500 - 1010);
        assertThat(walletLedgerService.reconcile(buyer).consistent()).isTrue();
    }

    @Test
    @DisplayName("CHK-011: Token worth less than total plus fee is credited but does not pay")
    void tokenUnderpayment() throws Exception {
        String buyer = createBuyer(0);
        addToCart(buyer, createListing(createSeller(), 1000));
        CheckoutSession session = checkoutService.start(buyer);
        String token = mockPaymentProcessor.issueToken(1009);

        assertThatThrownBy(() -> checkoutService.complete(session.getId(), PaymentMethod.TOKEN, token))
                .isInstanceOf(InsufficientBalanceException.class)
                .satisfies(e -> {
                    assertThat(((InsufficientBalanceException) e).getNeeded()).isEqualTo(1010);
                    assertThat(((InsufficientBalanceException) e).getAvailable()).isEqualTo(1009);
                });
        assertThat(balanceOf(buyer)).isEqualTo(1009);
        assertThat(walletLedgerService.getHistory(buyer, 0, 10).getContent())
                .extracting(WalletTransaction::getKind, WalletTransaction::getAmount)
                .containsExactly(tuple(WalletTransactionKind.DEPOSIT, 1009L));
        assertThat(checkoutService.getSession(session.getId()).getStatus()).isEqualTo(CheckoutStatus.PENDING);

        // the redeemed value stays spendable
        walletFundingService.depositToken(buyer, mockPaymentProcessor.issueToken(1));
        checkoutService.complete(session.getId(), PaymentMethod.WALLET, null);
        assertThat(balanceOf(buyer)).isZero();
        assertThat(walletLedgerService.reconcile(buyer).consistent()).isTrue();
    }

    @Test
    @DisplayName("CHK-012: Rejected and reused tokens fail the payment")
    void invalidTokens() throws Exception {
        String buyer = createBuyer(0);
        addToCart(buyer, createListing(createSeller(), 100));
        CheckoutSession session = checkoutService.start(buyer);

        assertThatThrownBy(() -> checkoutService.complete(session.getId(), PaymentMethod.TOKEN, "not-a-token"))
                .isInstanceOf(PaymentFailedException.class);
        assertThatThrownBy(() -> checkoutService.complete(session.getId(), PaymentMethod.TOKEN, null))
                .isInstanceOf(PaymentFailedException.class);

        String token = mockPaymentProcessor.issueToken(500);
        walletFundingService.depositToken(buyer, token);
        assertThatThrownBy(() -> checkoutService.complete(session.getId(), PaymentMethod.TOKEN, token))
                .isInstanceOf(PaymentFailedException.class);
        assertThat(balanceOf(buyer)).isEqualTo(500);
    }
}
