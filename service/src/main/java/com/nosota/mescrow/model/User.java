package com.nosota.mescrow.model;

import com.nosota.mescrow.api.model.UserRole;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Marketplace participant as seen by the ledger.
 *
 * <p>{@code walletBalance} is a materialized view: it always equals the running sum of the
 * user's {@link WalletTransaction} amounts and is only written by the wallet ledger,
 * under a row lock.
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
public class User {

    /**
     * Stable public identifier supplied by the identity collaborator.
     */
    @Id
    @Column(name = "id", length = 128, updatable = false, nullable = false)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false)
    private UserRole role;

    /**
     * Current balance in sats. Never negative.
     */
    @Column(name = "wallet_balance", nullable = false)
    private Long walletBalance;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
