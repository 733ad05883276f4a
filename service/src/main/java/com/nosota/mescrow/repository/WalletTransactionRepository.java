package com.nosota.mescrow.repository;

import com.nosota.mescrow.api.model.WalletTransactionKind;
import com.nosota.mescrow.model.WalletTransaction;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface WalletTransactionRepository extends JpaRepository<WalletTransaction, UUID> {

    /**
     * Ledger entries of a user, newest first.
     */
    Page<WalletTransaction> findByUserIdOrderByCreatedAtDescIdDesc(String userId, Pageable pageable);

    List<WalletTransaction> findByReferenceId(String referenceId);

    List<WalletTransaction> findByReferenceIdAndKind(String referenceId, WalletTransactionKind kind);

    /**
     * Sum of all signed amounts for a user. Equals the user's balance when the ledger is consistent.
     */
    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM WalletTransaction t WHERE t.userId = :userId")
    Long sumAmountByUserId(@Param("userId") String userId);

    long countByUserId(String userId);
}
