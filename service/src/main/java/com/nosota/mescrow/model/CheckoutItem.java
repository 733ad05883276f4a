package com.nosota.mescrow.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.util.UUID;

/**
 * Listing price snapshotted into a checkout session.
 */
@Entity
@Immutable
@Table(name = "checkout_items")
@Getter
@Setter
@NoArgsConstructor
public class CheckoutItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "checkout_id", nullable = false)
    private UUID checkoutId;

    @Column(name = "listing_id", nullable = false)
    private UUID listingId;

    @Column(name = "seller_id", nullable = false)
    private String sellerId;

    @Column(name = "locked_price", nullable = false)
    private Long lockedPrice;
}
