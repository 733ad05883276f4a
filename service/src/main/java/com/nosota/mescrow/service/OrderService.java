package com.nosota.mescrow.service;

import com.nosota.mescrow.api.model.OrderStatus;
import com.nosota.mescrow.error.EscrowAlreadyReleasedException;
import com.nosota.mescrow.error.EscrowNotFoundException;
import com.nosota.mescrow.error.NotAuthorizedException;
import com.nosota.mescrow.error.OrderAlreadyCompletedException;
import com.nosota.mescrow.error.OrderNotFoundException;
import com.nosota.mescrow.error.OrderNotShippableException;
import com.nosota.mescrow.error.UserNotFoundException;
import com.nosota.mescrow.model.Order;
import com.nosota.mescrow.model.OrderItem;
import com.nosota.mescrow.repository.OrderItemRepository;
import com.nosota.mescrow.repository.OrderRepository;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Order fulfilment: the seller ships, the buyer confirms delivery.
 *
 * <p>Confirming delivery releases the order's escrow to the seller; the escrow engine then
 * completes the order.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class OrderService {

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final EscrowService escrowService;
    private final Clock clock;

    /**
     * Marks a PENDING order as shipped.
     *
     * @throws NotAuthorizedException     if {@code sellerId} is not the order's seller
     * @throws OrderNotShippableException if the order is not PENDING
     */
    @Transactional(rollbackFor = Exception.class)
    public Order markShipped(@NotNull UUID orderId, @NotBlank String sellerId, @Size(max = 500) String trackingInfo)
            throws OrderNotFoundException, NotAuthorizedException, OrderNotShippableException {
        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        if (!order.getSellerId().equals(sellerId)) {
            throw new NotAuthorizedException("User " + sellerId + " is not the seller of order " + orderId);
        }
        if (order.getStatus() != OrderStatus.PENDING) {
            throw new OrderNotShippableException(orderId);
        }

        order.setStatus(OrderStatus.SHIPPED);
        order.setTrackingInfo(trackingInfo);
        order.setShippedAt(LocalDateTime.now(clock));
        order = orderRepository.save(order);

        log.info("Order shipped: orderId={}, sellerId={}, trackingInfo={}", orderId, sellerId, trackingInfo);
        return order;
    }

    /**
     * Buyer confirms delivery; the escrow is released to the seller.
     *
     * <p>Not transactional itself: the checks read a snapshot of the order and the release runs
     * in its own transaction, re-checking the escrow under lock.
     *
     * @throws NotAuthorizedException         if {@code buyerId} is not the order's buyer
     * @throws OrderAlreadyCompletedException if the order is no longer PENDING or SHIPPED
     */
    public Order confirmDelivery(@NotNull UUID orderId, @NotBlank String buyerId)
            throws OrderNotFoundException, NotAuthorizedException, OrderAlreadyCompletedException,
            EscrowNotFoundException, UserNotFoundException {
        Order order = getOrder(orderId);

        if (!order.getBuyerId().equals(buyerId)) {
            throw new NotAuthorizedException("User " + buyerId + " is not the buyer of order " + orderId);
        }
        if (order.getStatus() != OrderStatus.PENDING && order.getStatus() != OrderStatus.SHIPPED) {
            throw new OrderAlreadyCompletedException(orderId);
        }

        try {
            escrowService.release(order.getEscrowId());
        } catch (EscrowAlreadyReleasedException e) {
            // order was disputed or completed after the snapshot was taken
            throw new OrderAlreadyCompletedException(orderId);
        }

        log.info("Delivery confirmed: orderId={}, buyerId={}, escrowId={}", orderId, buyerId, order.getEscrowId());
        return getOrder(orderId);
    }

    @Transactional(readOnly = true)
    public Order getOrder(@NotNull UUID orderId) throws OrderNotFoundException {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    @Transactional(readOnly = true)
    public List<Order> listForBuyer(@NotBlank String buyerId) {
        return orderRepository.findByBuyerIdOrderByCreatedAtDesc(buyerId);
    }

    @Transactional(readOnly = true)
    public List<Order> listForSeller(@NotBlank String sellerId) {
        return orderRepository.findBySellerIdOrderByCreatedAtDesc(sellerId);
    }

    @Transactional(readOnly = true)
    public List<OrderItem> getItems(@NotNull UUID orderId) {
        return orderItemRepository.findByOrderId(orderId);
    }
}
