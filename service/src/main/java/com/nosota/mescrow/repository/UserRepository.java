package com.nosota.mescrow.repository;

import com.nosota.mescrow.model.User;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, String> {

    /**
     * Retrieves the {@link User} with the given ID and locks its row for update.
     * <p>
     * Every balance mutation goes through this lock, which serializes concurrent
     * credits and debits on the same wallet. Keep the surrounding transaction short.
     * </p>
     *
     * @param id The user ID.
     * @return The locked user, or empty if no such user exists.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM User u WHERE u.id = :id")
    Optional<User> findByIdForUpdate(@Param("id") String id);
}
