package com.nosota.mescrow.model;

import com.nosota.mescrow.api.model.EscrowStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Funds debited from a buyer and held until they are released to the seller,
 * refunded to the buyer, or split by a dispute resolution.
 *
 * <p>The id is assigned before persisting so the buyer's ESCROW_HOLD ledger entry
 * can reference it. {@code amount} never changes after creation.
 */
@Entity
@Table(name = "escrows")
@Getter
@Setter
@NoArgsConstructor
public class Escrow {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "buyer_id", nullable = false, updatable = false)
    private String buyerId;

    @Column(name = "seller_id", nullable = false, updatable = false)
    private String sellerId;

    @Column(name = "amount", nullable = false, updatable = false)
    private Long amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private EscrowStatus status;

    /**
     * Moment after which a still-HELD escrow is released to the seller automatically.
     */
    @Column(name = "auto_release_at", nullable = false)
    private LocalDateTime autoReleaseAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;
}
