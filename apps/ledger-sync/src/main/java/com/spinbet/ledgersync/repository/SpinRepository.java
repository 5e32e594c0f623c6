package com.spinbet.ledgersync.repository;

import com.spinbet.ledgersync.entity.Spin;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for spins. Both lookups lock the row.
 */
@Repository
public interface SpinRepository extends JpaRepository<Spin, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Spin s WHERE s.id = :id")
    Optional<Spin> findByIdForUpdate(@Param("id") String id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Spin s WHERE s.sessionId = :sessionId")
    Optional<Spin> findBySessionIdForUpdate(@Param("sessionId") String sessionId);
}
