package com.nosota.mescrow.repository;

import com.nosota.mescrow.api.model.DisputeStatus;
import com.nosota.mescrow.model.Dispute;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DisputeRepository extends JpaRepository<Dispute, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Dispute d WHERE d.id = :id")
    Optional<Dispute> findByIdForUpdate(@Param("id") UUID id);

    Optional<Dispute> findByOrderId(UUID orderId);

    boolean existsByOrderId(UUID orderId);

    List<Dispute> findByStatusOrderByAutoResolveAtAsc(DisputeStatus status);

    long countByStatus(DisputeStatus status);

    @Query("SELECT d FROM Dispute d WHERE d.status = :status AND d.autoResolveAt <= :now ORDER BY d.autoResolveAt")
    List<Dispute> findDueForAutoResolve(@Param("status") DisputeStatus status, @Param("now") LocalDateTime now);

    @Query("SELECT d FROM Dispute d WHERE d.status = :status AND d.warningSentAt IS NULL " +
            "AND d.autoResolveAt <= :threshold ORDER BY d.autoResolveAt")
    List<Dispute> findDueForWarning(@Param("status") DisputeStatus status, @Param("threshold") LocalDateTime threshold);
}
