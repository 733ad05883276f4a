package com.nosota.mescrow.service;

import com.nosota.mescrow.api.model.CheckoutStatus;
import com.nosota.mescrow.api.model.OrderStatus;
import com.nosota.mescrow.api.model.PaymentMethod;
import com.nosota.mescrow.api.model.WalletTransactionKind;
import com.nosota.mescrow.config.MarketplaceProperties;
import com.nosota.mescrow.error.CartEmptyException;
import com.nosota.mescrow.error.CheckoutSessionNotFoundException;
import com.nosota.mescrow.error.InsufficientBalanceException;
import com.nosota.mescrow.error.PaymentFailedException;
import com.nosota.mescrow.error.PriceLockExpiredException;
import com.nosota.mescrow.error.UserNotFoundException;
import com.nosota.mescrow.model.CartItem;
import com.nosota.mescrow.model.CheckoutItem;
import com.nosota.mescrow.model.CheckoutSession;
import com.nosota.mescrow.model.Escrow;
import com.nosota.mescrow.model.Listing;
import com.nosota.mescrow.model.Order;
import com.nosota.mescrow.model.OrderItem;
import com.nosota.mescrow.repository.CartItemRepository;
import com.nosota.mescrow.repository.CheckoutItemRepository;
import com.nosota.mescrow.repository.CheckoutSessionRepository;
import com.nosota.mescrow.repository.ListingRepository;
import com.nosota.mescrow.repository.OrderItemRepository;
import com.nosota.mescrow.repository.OrderRepository;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Checkout with a price lock.
 *
 * <p>{@link #start} snapshots the prices of the available listings in the buyer's cart into a
 * session that is valid for {@code priceLockHours}. Prices and fee are fixed at that moment.
 *
 * <p>{@link #complete} pays the session: the fee is debited once, then each seller's subtotal goes
 * into its own escrow (one escrow and one order per seller), and the cart is cleared.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class CheckoutService {

    private final CheckoutSessionRepository checkoutSessionRepository;
    private final CheckoutItemRepository checkoutItemRepository;
    private final CartItemRepository cartItemRepository;
    private final ListingRepository listingRepository;
    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final EscrowService escrowService;
    private final WalletLedgerService walletLedgerService;
    private final WalletFundingService walletFundingService;
    private final MarketplaceProperties marketplaceProperties;
    private final Clock clock;

    /**
     * Starts a checkout for a user, or returns the user's still-valid pending session.
     *
     * <p>Unavailable listings in the cart are left out of the snapshot.
     *
     * @param userId Buyer
     * @return Pending session with locked prices
     * @throws UserNotFoundException if the user does not exist
     * @throws CartEmptyException    if the cart holds no available listing
     */
    @Transactional(rollbackFor = Exception.class)
    public CheckoutSession start(@NotBlank String userId) throws UserNotFoundException, CartEmptyException {
        walletLedgerService.requireUser(userId);
        LocalDateTime now = LocalDateTime.now(clock);

        Optional<CheckoutSession> pending = checkoutSessionRepository
                .findFirstByUserIdAndStatusAndExpiresAtAfterOrderByCreatedAtDesc(userId, CheckoutStatus.PENDING, now);
        if (pending.isPresent()) {
            log.debug("Returning pending checkout session: sessionId={}, userId={}", pending.get().getId(), userId);
            return pending.get();
        }

        List<CartItem> cart = cartItemRepository.findByUserIdOrderByAddedAtAsc(userId);
        List<Listing> available = new ArrayList<>();
        for (CartItem cartItem : cart) {
            listingRepository.findById(cartItem.getListingId())
                    .filter(Listing::isAvailable)
                    .ifPresent(available::add);
        }
        if (available.isEmpty()) {
            throw new CartEmptyException(userId);
        }

        long total = available.stream().mapToLong(Listing::getPrice).sum();
        long fee = total * marketplaceProperties.feePercent() / 100;

        CheckoutSession session = new CheckoutSession();
        session.setUserId(userId);
        session.setStatus(CheckoutStatus.PENDING);
        session.setTotalAmount(total);
        session.setFeeAmount(fee);
        session.setCreatedAt(now);
        session.setExpiresAt(now.plusHours(marketplaceProperties.priceLockHours()));
        session = checkoutSessionRepository.save(session);

        for (Listing listing : available) {
            CheckoutItem item = new CheckoutItem();
            item.setCheckoutId(session.getId());
            item.setListingId(listing.getId());
            item.setSellerId(listing.getSellerId());
            item.setLockedPrice(listing.getPrice());
            checkoutItemRepository.save(item);
        }

        log.info("Started checkout: sessionId={}, userId={}, items={}, total={}, fee={}, expiresAt={}",
                session.getId(), userId, available.size(), total, fee, session.getExpiresAt());
        return session;
    }

    /**
     * Pays a pending checkout session.
     *
     * <p>For {@link PaymentMethod#TOKEN}, the token is redeemed and its whole value credited to the
     * buyer (DEPOSIT) before anything else; the redeemed amount must cover total + fee, and any
     * surplus stays in the buyer's wallet. That credit is committed on its own, so it survives a
     * later failure of the checkout.
     *
     * <p>A PENDING session past its lock is marked EXPIRED and the call fails.
     *
     * <p>Then, in one transaction: the buyer must hold total + fee; the fee is debited (FEE,
     * referenceId = session ID); one escrow is created per seller for that seller's subtotal;
     * one order (with its items) is created per escrow; the session becomes PAID and the cart
     * is cleared.
     *
     * @param sessionId Checkout session
     * @param method    Payment method
     * @param token     Payment token, required for {@link PaymentMethod#TOKEN}
     * @return Created orders, one per seller
     * @throws CheckoutSessionNotFoundException if the session does not exist
     * @throws PriceLockExpiredException        if the session is not PENDING or its lock has expired
     * @throws InsufficientBalanceException     if the token or wallet does not cover total + fee
     * @throws PaymentFailedException           if the token is rejected
     */
    @Transactional(rollbackFor = Exception.class, noRollbackFor = PriceLockExpiredException.class)
    public List<Order> complete(@NotNull UUID sessionId, @NotNull PaymentMethod method, String token)
            throws CheckoutSessionNotFoundException, PriceLockExpiredException, InsufficientBalanceException,
            PaymentFailedException, UserNotFoundException {
        CheckoutSession session = checkoutSessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> new CheckoutSessionNotFoundException(sessionId));

        LocalDateTime now = LocalDateTime.now(clock);
        if (!session.isPayableAt(now)) {
            if (session.getStatus() == CheckoutStatus.PENDING) {
                session.setStatus(CheckoutStatus.EXPIRED);
                checkoutSessionRepository.save(session);
                log.info("Checkout session expired: sessionId={}, userId={}", sessionId, session.getUserId());
            }
            throw new PriceLockExpiredException(sessionId);
        }

        String buyerId = session.getUserId();
        long required = session.getTotalAmount() + session.getFeeAmount();

        if (method == PaymentMethod.TOKEN) {
            if (token == null || token.isBlank()) {
                throw new PaymentFailedException("Token is required for token payment");
            }
            long redeemed = walletFundingService.depositToken(buyerId, token);
            if (redeemed < required) {
                log.warn("Redeemed token does not cover payment: sessionId={}, redeemed={}, required={}",
                        sessionId, redeemed, required);
                throw new InsufficientBalanceException(required, redeemed);
            }
        }

        long balance = walletLedgerService.lockBalance(buyerId);
        if (balance < required) {
            throw new InsufficientBalanceException(required, balance);
        }

        if (session.getFeeAmount() > 0) {
            walletLedgerService.debit(buyerId, session.getFeeAmount(), WalletTransactionKind.FEE,
                    sessionId.toString(), "Platform fee");
        }

        Map<String, List<CheckoutItem>> bySeller = checkoutItemRepository.findByCheckoutId(sessionId).stream()
                .collect(Collectors.groupingBy(CheckoutItem::getSellerId, LinkedHashMap::new, Collectors.toList()));

        List<Order> orders = new ArrayList<>();
        for (Map.Entry<String, List<CheckoutItem>> group : bySeller.entrySet()) {
            String sellerId = group.getKey();
            long subtotal = group.getValue().stream().mapToLong(CheckoutItem::getLockedPrice).sum();

            Escrow escrow = escrowService.createEscrow(buyerId, sellerId, subtotal);
            orders.add(createOrder(session, sellerId, escrow, group.getValue(), now));
        }

        session.setStatus(CheckoutStatus.PAID);
        session.setPaidAt(now);
        checkoutSessionRepository.save(session);

        cartItemRepository.deleteByUserId(buyerId);

        log.info("Completed checkout: sessionId={}, buyerId={}, method={}, total={}, fee={}, orders={}",
                sessionId, buyerId, method, session.getTotalAmount(), session.getFeeAmount(), orders.size());
        return orders;
    }

    @Transactional(readOnly = true)
    public CheckoutSession getSession(@NotNull UUID sessionId) throws CheckoutSessionNotFoundException {
        return checkoutSessionRepository.findById(sessionId)
                .orElseThrow(() -> new CheckoutSessionNotFoundException(sessionId));
    }

    @Transactional(readOnly = true)
    public List<CheckoutItem> getItems(@NotNull UUID sessionId) {
        return checkoutItemRepository.findByCheckoutId(sessionId);
    }

    private Order createOrder(CheckoutSession session, String sellerId, Escrow escrow,
                              List<CheckoutItem> items, LocalDateTime now) {
        Order order = new Order();
        order.setCheckoutId(session.getId());
        order.setBuyerId(session.getUserId());
        order.setSellerId(sellerId);
        order.setEscrowId(escrow.getId());
        order.setStatus(OrderStatus.PENDING);
        order.setCreatedAt(now);
        order = orderRepository.save(order);

        for (CheckoutItem item : items) {
            OrderItem orderItem = new OrderItem();
            orderItem.setOrderId(order.getId());
            orderItem.setListingId(item.getListingId());
            orderItem.setPrice(item.getLockedPrice());
            orderItemRepository.save(orderItem);
        }

        log.info("Created order: orderId={}, sessionId={}, sellerId={}, escrowId={}, amount={}",
                order.getId(), session.getId(), sellerId, escrow.getId(), escrow.getAmount());
        return order;
    }
}
