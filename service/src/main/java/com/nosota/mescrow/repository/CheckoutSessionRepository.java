package com.nosota.mescrow.repository;

import com.nosota.mescrow.api.model.CheckoutStatus;
import com.nosota.mescrow.model.CheckoutSession;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CheckoutSessionRepository extends JpaRepository<CheckoutSession, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM CheckoutSession s WHERE s.id = :id")
    Optional<CheckoutSession> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Newest session of a user in {@code status} that is still valid at {@code now}.
     */
    Optional<CheckoutSession> findFirstByUserIdAndStatusAndExpiresAtAfterOrderByCreatedAtDesc(
            String userId, CheckoutStatus status, LocalDateTime now);
}
