package com.nosota.mescrow.model;

import com.nosota.mescrow.api.model.WalletTransactionKind;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only ledger entry. One row per balance mutation.
 *
 * <p>{@code amount} is signed: positive for credits, negative for debits.
 * {@code balanceAfter} is the wallet balance right after this entry was applied.
 * {@code referenceId} points at the escrow, checkout session or payment the entry belongs to.
 */
@Entity
@Immutable
@Table(name = "wallet_transactions")
@Getter
@Setter
@NoArgsConstructor
public class WalletTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, updatable = false)
    private WalletTransactionKind kind;

    @Column(name = "amount", nullable = false, updatable = false)
    private Long amount;

    @Column(name = "balance_after", nullable = false, updatable = false)
    private Long balanceAfter;

    @Column(name = "reference_id", updatable = false)
    private String referenceId;

    @Column(name = "description", updatable = false)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
