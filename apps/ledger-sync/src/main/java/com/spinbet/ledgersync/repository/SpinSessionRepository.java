package com.spinbet.ledgersync.repository;

import com.spinbet.ledgersync.entity.SpinSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SpinSessionRepository extends JpaRepository<SpinSession, String> {

    Optional<SpinSession> findFirstByTxReference(String txReference);
}
