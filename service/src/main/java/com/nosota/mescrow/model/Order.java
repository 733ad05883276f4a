package com.nosota.mescrow.model;

import com.nosota.mescrow.api.model.OrderStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Purchase from a single seller, created by checkout. Backed by exactly one escrow.
 *
 * <p>Mapped under the entity name {@code PurchaseOrder} since {@code Order} is reserved in JPQL.
 */
@Entity(name = "PurchaseOrder")
@Table(name = "orders")
@Getter
@Setter
@NoArgsConstructor
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "checkout_id", updatable = false)
    private UUID checkoutId;

    @Column(name = "buyer_id", nullable = false, updatable = false)
    private String buyerId;

    @Column(name = "seller_id", nullable = false, updatable = false)
    private String sellerId;

    @Column(name = "escrow_id", nullable = false, updatable = false, unique = true)
    private UUID escrowId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private OrderStatus status;

    @Column(name = "tracking_info", length = 500)
    private String trackingInfo;

    @Column(name = "shipped_at")
    private LocalDateTime shippedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
