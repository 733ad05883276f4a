package com.nosota.mescrow.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Entity
@Table(name = "order_items")
@Getter
@Setter
@NoArgsConstructor
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "order_id", nullable = false, updatable = false)
    private UUID orderId;

    @Column(name = "listing_id", nullable = false, updatable = false)
    private UUID listingId;

    /**
     * Price paid, copied from the locked checkout price.
     */
    @Column(name = "price", nullable = false, updatable = false)
    private Long price;
}
