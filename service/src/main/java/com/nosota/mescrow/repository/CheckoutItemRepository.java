package com.nosota.mescrow.repository;

import com.nosota.mescrow.model.CheckoutItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CheckoutItemRepository extends JpaRepository<CheckoutItem, UUID> {

    List<CheckoutItem> findByCheckoutId(UUID checkoutId);
}
