package com.nosota.mescrow.repository;

import com.nosota.mescrow.api.model.SellerCategory;
import com.nosota.mescrow.model.SellerBond;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SellerBondRepository extends JpaRepository<SellerBond, UUID> {

    List<SellerBond> findByUserIdOrderByCategoryAsc(String userId);

    boolean existsByUserIdAndCategory(String userId, SellerCategory category);

    boolean existsByUserId(String userId);
}
