package com.nosota.mescrow.repository;

import com.nosota.mescrow.model.Order;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrderRepository extends JpaRepository<Order, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM PurchaseOrder o WHERE o.id = :id")
    Optional<Order> findByIdForUpdate(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM PurchaseOrder o WHERE o.escrowId = :escrowId")
    Optional<Order> findByEscrowIdForUpdate(@Param("escrowId") UUID escrowId);

    /**
     * Escrow backing an order, read without loading the order into the persistence context.
     */
    @Query("SELECT o.escrowId FROM PurchaseOrder o WHERE o.id = :id")
    Optional<UUID> findEscrowIdById(@Param("id") UUID id);

    Optional<Order> findByEscrowId(UUID escrowId);

    List<Order> findByBuyerIdOrderByCreatedAtDesc(String buyerId);

    List<Order> findBySellerIdOrderByCreatedAtDesc(String sellerId);

    List<Order> findByCheckoutId(UUID checkoutId);
}
