package com.nosota.mescrow.repository;

import com.nosota.mescrow.api.model.EscrowStatus;
import com.nosota.mescrow.model.Escrow;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EscrowRepository extends JpaRepository<Escrow, UUID> {

    /**
     * Retrieves the escrow and locks its row for update.
     * <p>
     * Status checks of release, refund and dispute resolution run under this lock,
     * so two concurrent transitions of the same escrow can never both succeed.
     * </p>
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM Escrow e WHERE e.id = :id")
    Optional<Escrow> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Moves an escrow from {@code from} to {@code to} in a single conditional update.
     * The update takes the row lock itself.
     *
     * @return 1 if the escrow was in {@code from} and is now in {@code to}, 0 otherwise
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Escrow e SET e.status = :to WHERE e.id = :id AND e.status = :from")
    int transitionStatus(@Param("id") UUID id, @Param("from") EscrowStatus from, @Param("to") EscrowStatus to);

    /**
     * IDs of escrows in {@code status} whose auto-release moment is at or before {@code now}.
     */
    @Query("SELECT e.id FROM Escrow e WHERE e.status = :status AND e.autoReleaseAt <= :now ORDER BY e.autoReleaseAt")
    List<UUID> findIdsDueForAutoRelease(@Param("status") EscrowStatus status, @Param("now") LocalDateTime now);

    @Query("SELECT COALESCE(SUM(e.amount), 0) FROM Escrow e WHERE e.status IN :statuses")
    Long sumAmountByStatusIn(@Param("statuses") List<EscrowStatus> statuses);
}
