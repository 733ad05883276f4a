package com.nosota.mescrow.model;

import com.nosota.mescrow.api.model.CheckoutStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Time-bounded price lock over a buyer's cart.
 *
 * <p>Totals are computed once when the session is started and never recomputed.
 * A PENDING session is only payable while {@code expiresAt} is in the future.
 */
@Entity
@Table(name = "checkout_sessions")
@Getter
@Setter
@NoArgsConstructor
public class CheckoutSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private CheckoutStatus status;

    /**
     * Sum of locked item prices.
     */
    @Column(name = "total_amount", nullable = false, updatable = false)
    private Long totalAmount;

    /**
     * Platform fee, computed from {@code totalAmount} at lock time.
     */
    @Column(name = "fee_amount", nullable = false, updatable = false)
    private Long feeAmount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private LocalDateTime expiresAt;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    public boolean isPayableAt(LocalDateTime now) {
        return status == CheckoutStatus.PENDING && expiresAt.isAfter(now);
    }
}
