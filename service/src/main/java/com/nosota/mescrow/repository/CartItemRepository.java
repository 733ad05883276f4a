package com.nosota.mescrow.repository;

import com.nosota.mescrow.model.CartItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CartItemRepository extends JpaRepository<CartItem, UUID> {

    List<CartItem> findByUserIdOrderByAddedAtAsc(String userId);

    @Modifying
    @Query("DELETE FROM CartItem c WHERE c.userId = :userId")
    int deleteByUserId(@Param("userId") String userId);
}
