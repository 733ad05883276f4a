package com.nosota.mescrow.model;

import com.nosota.mescrow.api.model.SellerCategory;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A category a seller may list in, with the share of the bond paid for it.
 * One row per (user, category); never ALL, which is stored as its three categories.
 */
@Entity
@Table(name = "seller_categories",
        uniqueConstraints = @UniqueConstraint(name = "uq_seller_categories_user_category",
                columnNames = {"user_id", "category"}))
@Getter
@Setter
@NoArgsConstructor
public class SellerBond {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, updatable = false)
    private SellerCategory category;

    @Column(name = "bond_paid", nullable = false)
    private Long bondPaid;

    @Column(name = "paid_at", nullable = false)
    private LocalDateTime paidAt;
}
